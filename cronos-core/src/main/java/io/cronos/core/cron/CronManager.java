package io.cronos.core.cron;

import io.cronos.core.backup.BackupCoordinator;
import io.cronos.core.executor.JobExecutor;
import io.cronos.core.executor.JobExecutors;
import io.cronos.core.persistence.PersistenceException;
import io.cronos.core.persistence.SqliteJobStore;
import io.cronos.core.persistence.StoredJob;
import io.cronos.core.schedule.CronSchedule;
import io.cronos.core.schedule.ScheduleException;
import io.cronos.core.schedule.TriggerHandle;
import io.cronos.core.schedule.TriggerScheduler;
import io.cronos.core.storage.Storage;
import io.cronos.core.sync.SyncLoop;
import io.cronos.core.sync.SyncTask;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CronManager {
    private static final Logger LOG = LoggerFactory.getLogger(CronManager.class);
    private static final int MAX_ID_ATTEMPTS = 100;
    private static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(10);

    static final Comparator<Job> LIST_ORDER = Comparator
        .comparing(Job::lastRun, Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(Job::name, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Path databasePath;
    private final JobExecutors executors;
    private final TriggerScheduler scheduler;
    private final Clock clock;
    private final Duration shutdownGrace;
    private final Supplier<String> idSource;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> jobs = new HashMap<>();
    private final Set<String> removedIds = new HashSet<>();

    private final Object syncLock = new Object();
    private SyncLoop syncLoop;

    public CronManager(Path databasePath) {
        this(databasePath, JobExecutors.defaults(), Clock.systemDefaultZone(), ZoneId.systemDefault(), DEFAULT_SHUTDOWN_GRACE);
    }

    public CronManager(Path databasePath, JobExecutors executors, Clock clock, ZoneId zone, Duration shutdownGrace) {
        this(databasePath, executors, clock, new TriggerScheduler(clock, zone), shutdownGrace, () -> UUID.randomUUID().toString());
    }

    CronManager(
        Path databasePath,
        JobExecutors executors,
        Clock clock,
        TriggerScheduler scheduler,
        Duration shutdownGrace,
        Supplier<String> idSource
    ) {
        this.databasePath = Objects.requireNonNull(databasePath, "databasePath must not be null");
        this.executors = Objects.requireNonNull(executors, "executors must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.shutdownGrace = shutdownGrace == null ? DEFAULT_SHUTDOWN_GRACE : shutdownGrace;
        this.idSource = Objects.requireNonNull(idSource, "idSource must not be null");
    }

    public Path databasePath() {
        return databasePath;
    }

    public void start() {
        if (Files.exists(databasePath)) {
            try {
                LoadResult result = loadAll(databasePath);
                LOG.info("Loaded {} jobs from {}", result.loaded(), databasePath);
            } catch (PersistenceException e) {
                LOG.warn("Failed to load jobs from database {}", databasePath, e);
            }
        }
        scheduler.start();
        LOG.info("Cron manager started with {} jobs", size());
    }

    public void stop() throws PersistenceException {
        scheduler.stop(shutdownGrace);
        synchronized (syncLock) {
            if (syncLoop != null) {
                try {
                    syncLoop.cancelAndJoin();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted while waiting for background sync to stop");
                }
                syncLoop = null;
            }
        }
        saveAll();
        LOG.info("Cron manager stopped");
    }

    public void startBackgroundSync(Duration saveInterval, Duration backupInterval, String remoteName, Storage storage)
        throws InterruptedException {
        synchronized (syncLock) {
            if (syncLoop != null) {
                syncLoop.cancelAndJoin();
                syncLoop = null;
            }
            SyncTask backupTask = null;
            if (storage != null && remoteName != null && !remoteName.isBlank()) {
                BackupCoordinator coordinator = new BackupCoordinator(storage);
                backupTask = () -> coordinator.backup(databasePath, remoteName);
            }
            syncLoop = SyncLoop.start(() -> saveAll(), saveInterval, backupTask, backupInterval);
            LOG.info("Background sync started (save every {}, backup {})",
                saveInterval, backupTask == null ? "disabled" : "every " + backupInterval + " to " + remoteName);
        }
    }

    public Optional<SyncLoop> backgroundSync() {
        synchronized (syncLock) {
            return Optional.ofNullable(syncLoop);
        }
    }

    public Job addJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        lock.writeLock().lock();
        try {
            return admit(job);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the definition of an existing job, keeping its id and run history. The new definition is fully
     * validated first, and the swap happens under one exclusive lock, so readers never see the job missing and a
     * rejected update leaves the original in place.
     */
    public Job updateJob(String jobId, Job definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        validate(definition);
        if (definition.schedule() == null || definition.schedule().isBlank()) {
            throw new JobValidationException("schedule cannot be empty");
        }
        CronSchedule.parse(definition.schedule());

        lock.writeLock().lock();
        try {
            Entry existing = jobs.get(jobId);
            if (existing == null) {
                throw new JobNotFoundException(jobId);
            }
            return admit(definition.withId(jobId).withLastRun(existing.job().lastRun()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeJob(String jobId) {
        lock.writeLock().lock();
        try {
            Entry removed = jobs.remove(jobId);
            if (removed == null) {
                throw new JobNotFoundException(jobId);
            }
            scheduler.unregister(removed.handle());
            removedIds.add(jobId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Job getJob(String jobId) {
        lock.readLock().lock();
        try {
            Entry entry = jobs.get(jobId);
            if (entry == null) {
                throw new JobNotFoundException(jobId);
            }
            return entry.job();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Job> listJobs() {
        List<Job> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(jobs.size());
            for (Entry entry : jobs.values()) {
                snapshot.add(entry.job());
            }
        } finally {
            lock.readLock().unlock();
        }
        snapshot.sort(LIST_ORDER);
        return snapshot;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return jobs.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String describeSchedule(String expression) {
        return CronSchedule.describe(expression);
    }

    public String generateUniqueId() {
        lock.readLock().lock();
        try {
            for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
                String id = idSource.get();
                if (id != null && !id.isBlank() && !jobs.containsKey(id)) {
                    return id;
                }
            }
            Instant now = clock.instant();
            long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
            while (jobs.containsKey("job_" + nanos)) {
                nanos++;
            }
            return "job_" + nanos;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void saveAll() throws PersistenceException {
        saveAll(databasePath);
    }

    public void saveAll(Path path) throws PersistenceException {
        List<Job> snapshot;
        Set<String> deleted;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(jobs.size());
            for (Entry entry : jobs.values()) {
                snapshot.add(entry.job());
            }
            deleted = Set.copyOf(removedIds);
        } finally {
            lock.readLock().unlock();
        }

        new SqliteJobStore(path).upsertAll(snapshot, deleted);

        if (!deleted.isEmpty()) {
            lock.writeLock().lock();
            try {
                removedIds.removeAll(deleted);
            } finally {
                lock.writeLock().unlock();
            }
        }
        LOG.debug("Saved {} jobs to {}", snapshot.size(), path);
    }

    public LoadResult loadAll(Path path) throws PersistenceException {
        List<StoredJob> rows = new SqliteJobStore(path).loadAll();
        int loaded = 0;
        List<String> failures = new ArrayList<>();
        for (StoredJob row : rows) {
            if (!row.isDecoded()) {
                LOG.warn("Skipping job row: {}", row.error());
                failures.add(row.error());
                continue;
            }
            try {
                addJob(row.job());
                loaded++;
            } catch (JobValidationException | ScheduleException e) {
                String failure = "failed to add job " + row.id() + ": " + e.getMessage();
                LOG.warn("Skipping job row: {}", failure);
                failures.add(failure);
            }
        }
        LoadResult result = new LoadResult(loaded, failures);
        if (result.hasFailures()) {
            LOG.warn("Some jobs failed to load from {}: loaded={} errors={}", path, loaded, failures.size());
        }
        return result;
    }

    void executeJob(String jobId) {
        Job job;
        lock.readLock().lock();
        try {
            Entry entry = jobs.get(jobId);
            if (entry == null) {
                return;
            }
            job = entry.job();
        } finally {
            lock.readLock().unlock();
        }

        if (!job.enabled()) {
            return;
        }
        Optional<JobExecutor> executor = executors.find(job.type());
        if (executor.isEmpty()) {
            LOG.error("No executor for job {} (id {}, type {})", job.name(), jobId, job.type());
            return;
        }

        LOG.info("Executing job {} (type {}, id {})", job.name(), job.type().value(), jobId);
        try {
            executor.get().execute(job.config());
            LOG.info("Job {} executed successfully (id {})", job.name(), jobId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Job {} interrupted (id {})", job.name(), jobId);
        } catch (Exception e) {
            LOG.error("Job {} execution failed (id {})", job.name(), jobId, e);
        }

        recordRun(jobId);
    }

    private void recordRun(String jobId) {
        lock.writeLock().lock();
        try {
            Entry entry = jobs.get(jobId);
            if (entry == null) {
                return;
            }
            Job updated = entry.job().withLastRun(clock.instant().truncatedTo(ChronoUnit.SECONDS));
            if (scheduler.isRegistered(entry.handle())) {
                updated = updated.withNextRun(scheduler.nextFire(entry.handle()).orElse(null));
            }
            jobs.put(jobId, new Entry(updated, entry.handle()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private Job admit(Job job) {
        validate(job);
        CronSchedule schedule = CronSchedule.parse(job.schedule());
        String id = job.id() == null || job.id().isBlank() ? generateUniqueId() : job.id();

        Job candidate = job.withId(id)
            .withScheduleDesc(describe(schedule, job.schedule()))
            .withNextRun(null);
        TriggerHandle handle = null;
        if (candidate.enabled()) {
            handle = scheduler.register(schedule, () -> executeJob(id));
            candidate = candidate.withNextRun(scheduler.nextFire(handle).orElse(null));
        }

        Entry previous = jobs.put(id, new Entry(candidate, handle));
        if (previous != null) {
            scheduler.unregister(previous.handle());
        }
        removedIds.remove(id);
        return candidate;
    }

    private JobExecutor validate(Job job) {
        if (job.type() == null) {
            throw new JobValidationException("unknown job type: null");
        }
        JobExecutor executor = executors.find(job.type())
            .orElseThrow(() -> new JobValidationException("unknown job type: " + job.type().value()));
        executor.validate(job.config());
        return executor;
    }

    private static String describe(CronSchedule schedule, String raw) {
        try {
            return schedule.description();
        } catch (RuntimeException e) {
            LOG.warn("Could not generate schedule description for '{}': {}", raw, e.getMessage());
            return raw;
        }
    }

    private record Entry(Job job, TriggerHandle handle) {
    }
}
