package io.cronos.cli;

import io.cronos.core.backup.BackupCoordinator;
import io.cronos.core.config.model.CronosConfig;
import io.cronos.core.persistence.SqliteJobStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration, database and backup status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronosConfig config = context.loadConfig();
            Path database = context.databasePath(config);
            boolean databaseExists = Files.exists(database);
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + database);
            System.out.println("Database exists: " + databaseExists);
            if (databaseExists) {
                System.out.println("Stored jobs: " + new SqliteJobStore(database).count());
            }
            System.out.println("Save interval: " + config.sync().saveInterval().toSeconds() + "s");
            System.out.println("Storage provider: " + config.storage().normalizedProvider());
            System.out.println("Storage configured: " + config.storage().configured());
            if (config.storage().configured()) {
                System.out.println("Backup interval: " + config.sync().backupInterval().toSeconds() + "s");
                System.out.println("Remote name: " + config.sync().remoteName());
            }
            Path marker = BackupCoordinator.markerPath(database);
            if (Files.exists(marker)) {
                System.out.println("Last backup checksum: " + Files.readString(marker).trim());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
