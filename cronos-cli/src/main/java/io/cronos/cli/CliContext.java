package io.cronos.cli;

import io.cronos.core.config.ConfigPaths;
import io.cronos.core.config.ConfigService;
import io.cronos.core.config.model.CronosConfig;
import io.cronos.core.cron.CronManager;
import io.cronos.core.cron.LoadResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, restore -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }

    public CronosConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public Path databasePath(CronosConfig config) {
        return ConfigPaths.resolve(config.database(), baseDirectory());
    }

    public Path baseDirectory() {
        return configPath.toAbsolutePath().getParent();
    }

    /**
     * A registry holding the jobs currently stored in the database. Its triggers are never started.
     */
    public CronManager openRegistry(CronosConfig config) throws IOException {
        Path database = databasePath(config);
        CronManager manager = new CronManager(database);
        if (Files.exists(database)) {
            LoadResult result = manager.loadAll(database);
            for (String failure : result.failures()) {
                System.err.println("Skipped stored job: " + failure);
            }
        }
        return manager;
    }
}
