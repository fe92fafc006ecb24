package io.cronos.core.cron;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronos.core.executor.JobExecutors;
import io.cronos.core.persistence.SqliteJobStore;
import io.cronos.core.storage.LocalDirectoryStorage;
import io.cronos.core.sync.SyncLoop;
import io.cronos.core.sync.SyncState;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CronManagerPersistenceTest {

    @TempDir
    Path tempDir;

    @Test
    void savedJobsShouldLoadBackIntoFreshRegistry() throws Exception {
        Path db = tempDir.resolve("cron_jobs.db");
        Clock clock = Clock.fixed(Instant.parse("2026-04-02T10:20:30Z"), ZoneOffset.UTC);
        CronManager first = newManager(db, clock);
        Job email = first.addJob(Job.of("digest", JobType.EMAIL, "0 0 9 * * 1-5",
            Map.of("to", "ops@example.com", "subject", "Daily", "body", "see attached")).withLastRun(Instant.parse("2026-04-02T08:00:00Z")));
        Job backup = first.addJob(Job.of("snapshot", JobType.BACKUP, "@hourly",
            Map.of("path", "/data", "destination", "s3://bucket/data", "retries", 3)));
        Job paused = first.addJob(Job.of("paused", JobType.CUSTOM, "0 0 0 * * *", Map.of("command", "true")).withEnabled(false));
        first.saveAll();

        CronManager second = newManager(db, clock);
        LoadResult result = second.loadAll(db);

        assertThat(result.loaded()).isEqualTo(3);
        assertThat(result.error()).isEmpty();
        assertThat(second.listJobs()).containsExactlyInAnyOrderElementsOf(List.of(email, backup, paused));
        assertThat(second.getJob(backup.id()).nextRun()).isEqualTo(Instant.parse("2026-04-02T11:00:00Z"));
        assertThat(second.getJob(paused.id()).nextRun()).isNull();
    }

    @Test
    void removedJobsShouldBeDeletedOnNextSave() throws Exception {
        Path db = tempDir.resolve("cron_jobs.db");
        CronManager manager = newManager(db);
        Job keep = manager.addJob(custom("keep"));
        Job drop = manager.addJob(custom("drop"));
        manager.saveAll();

        manager.removeJob(drop.id());
        manager.saveAll();

        CronManager reloaded = newManager(db);
        reloaded.loadAll(db);
        assertThat(new SqliteJobStore(db).count()).isEqualTo(1);
        assertThat(reloaded.listJobs()).extracting(Job::id).containsExactly(keep.id());
    }

    @Test
    void badRowsShouldBeSkippedWhileGoodRowsLoad() throws Exception {
        Path db = tempDir.resolve("cron_jobs.db");
        CronManager writer = newManager(db);
        Job good = writer.addJob(custom("good"));
        writer.saveAll();
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("INSERT INTO jobs (id, name, type, schedule, enabled, config) "
                + "VALUES ('t1', 'alien', 'teleport', '0 * * * * *', 1, '{}')");
            statement.executeUpdate("INSERT INTO jobs (id, name, type, schedule, enabled, config) "
                + "VALUES ('t2', 'incomplete', 'email', '0 * * * * *', 1, '{\"to\":\"a@example.com\"}')");
            statement.executeUpdate("INSERT INTO jobs (id, name, type, schedule, enabled, config) "
                + "VALUES ('t3', 'garbled', 'custom', 'every tuesday', 1, '{\"command\":\"true\"}')");
            statement.executeUpdate("INSERT INTO jobs (id, name, type, schedule, enabled, config) "
                + "VALUES ('t4', 'corrupt', 'custom', '0 * * * * *', 1, '{not json')");
        }

        CronManager reader = newManager(db);
        LoadResult result = reader.loadAll(db);

        assertThat(result.loaded()).isEqualTo(1);
        assertThat(result.failures()).hasSize(4);
        assertThat(result.error()).isPresent();
        assertThat(result.error().get().getMessage()).contains("loaded 1 jobs with 4 errors");
        assertThat(reader.listJobs()).extracting(Job::id).containsExactly(good.id());
    }

    @Test
    void startShouldLoadExistingDatabaseAndStopShouldSaveFinalState() throws Exception {
        Path db = tempDir.resolve("data/cron_jobs.db");
        CronManager first = newManager(db);
        Job job = first.addJob(custom("persisted"));
        first.saveAll();

        CronManager second = newManager(db);
        second.start();
        Job added = second.addJob(custom("added-after-start"));
        second.stop();

        assertThat(second.getJob(job.id()).name()).isEqualTo("persisted");
        CronManager third = newManager(db);
        third.loadAll(db);
        assertThat(third.listJobs()).extracting(Job::id).containsExactlyInAnyOrder(job.id(), added.id());
    }

    @Test
    void startWithoutDatabaseShouldBeginEmpty() throws Exception {
        Path db = tempDir.resolve("fresh/cron_jobs.db");
        CronManager manager = newManager(db);

        manager.start();
        manager.stop();

        assertThat(manager.listJobs()).isEmpty();
        assertThat(Files.exists(db)).isTrue();
    }

    @Test
    void backgroundSyncShouldSaveAndBackUpUntilStopped() throws Exception {
        Path db = tempDir.resolve("cron_jobs.db");
        Path remoteRoot = tempDir.resolve("remote");
        CronManager manager = newManager(db);
        manager.addJob(custom("synced"));

        manager.startBackgroundSync(Duration.ofMillis(50), Duration.ofMillis(100), "cronos_backups/cron_jobs.db",
            new LocalDirectoryStorage(remoteRoot));
        SyncLoop loop = manager.backgroundSync().orElseThrow();
        long deadline = System.currentTimeMillis() + 5_000;
        while (loop.backupTicks() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        manager.stop();

        assertThat(loop.backupTicks()).isGreaterThanOrEqualTo(1);
        assertThat(loop.state()).isEqualTo(SyncState.STOPPED);
        assertThat(manager.backgroundSync()).isEmpty();
        assertThat(Files.exists(remoteRoot.resolve("cronos_backups/cron_jobs.db"))).isTrue();
        assertThat(new SqliteJobStore(db).count()).isEqualTo(1);
    }

    @Test
    void restartingBackgroundSyncShouldStopPreviousLoop() throws Exception {
        Path db = tempDir.resolve("cron_jobs.db");
        CronManager manager = newManager(db);

        manager.startBackgroundSync(Duration.ofMillis(50), Duration.ofHours(1), null, null);
        SyncLoop first = manager.backgroundSync().orElseThrow();
        manager.startBackgroundSync(Duration.ofMillis(50), Duration.ofHours(1), null, null);
        SyncLoop second = manager.backgroundSync().orElseThrow();

        assertThat(first.state()).isEqualTo(SyncState.STOPPED);
        assertThat(second).isNotSameAs(first);
        assertThat(second.backupEnabled()).isFalse();
        manager.stop();
        assertThat(second.state()).isEqualTo(SyncState.STOPPED);
    }

    private static CronManager newManager(Path db) {
        return newManager(db, Clock.systemUTC());
    }

    private static CronManager newManager(Path db, Clock clock) {
        return new CronManager(db, JobExecutors.defaults(), clock, ZoneOffset.UTC, Duration.ofSeconds(2));
    }

    private static Job custom(String name) {
        return Job.of(name, JobType.CUSTOM, "0 0 * * * *", Map.of("command", "echo " + name));
    }
}
