package io.cronos.app;

import io.cronos.cli.CliContext;
import io.cronos.cli.CronosCliCommand;
import io.cronos.core.backup.BackupCoordinator;
import io.cronos.core.config.ConfigPaths;
import io.cronos.core.config.ConfigService;
import io.cronos.core.config.model.CronosConfig;
import io.cronos.core.cron.CronManager;
import io.cronos.core.executor.JobExecutors;
import io.cronos.core.storage.Storage;
import io.cronos.core.storage.StorageFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CronosApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CronosApplication.class);

    private CronosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = resolveConfigPath();
        CliContext context = new CliContext(
            configService,
            configPath,
            restoreOnStart -> runServer(configService, configPath, restoreOnStart)
        );

        int exitCode = CronosCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String raw = System.getenv("CRONOS_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.resolve(raw, Path.of("").toAbsolutePath());
    }

    private static int runServer(ConfigService configService, Path configPath, boolean restoreAllowed) throws Exception {
        CronosConfig config = configService.load(configPath);
        Path baseDir = configPath.toAbsolutePath().getParent();
        Path database = ConfigPaths.resolve(config.database(), baseDir);
        Optional<Storage> storage = StorageFactory.create(config.storage(), baseDir);
        String remoteName = config.sync().remoteName();

        if (storage.isPresent() && restoreAllowed && config.sync().restoreOnStart()) {
            new BackupCoordinator(storage.get()).restore(database, remoteName);
        }

        CronManager manager = new CronManager(
            database,
            JobExecutors.defaults(),
            Clock.systemDefaultZone(),
            config.scheduler().zoneId(),
            config.scheduler().shutdownGrace()
        );

        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdown.countDown();
            try {
                // keep the JVM alive until the final save has run
                stopped.await(config.scheduler().shutdownGrace().toSeconds() + 30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "cronos-shutdown"));

        try {
            manager.start();
            manager.startBackgroundSync(config.sync().saveInterval(), config.sync().backupInterval(), remoteName, storage.orElse(null));
            System.out.println("Cronos started with " + manager.size() + " jobs from " + database);
            shutdown.await();
            LOG.info("Shutdown requested");
        } finally {
            try {
                manager.stop();
            } finally {
                if (storage.isPresent() && storage.get() instanceof AutoCloseable closeable) {
                    closeable.close();
                }
                stopped.countDown();
            }
        }
        return 0;
    }
}
