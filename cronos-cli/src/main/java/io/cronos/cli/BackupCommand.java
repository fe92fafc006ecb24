package io.cronos.cli;

import io.cronos.core.backup.BackupCoordinator;
import io.cronos.core.backup.BackupOutcome;
import io.cronos.core.config.model.CronosConfig;
import io.cronos.core.storage.Storage;
import io.cronos.core.storage.StorageFactory;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "backup", description = "Upload the job database to remote storage if it changed")
public final class BackupCommand implements Callable<Integer> {
    private final CliContext context;

    public BackupCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronosConfig config = context.loadConfig();
            Optional<Storage> storage = StorageFactory.create(config.storage(), context.baseDirectory());
            if (storage.isEmpty()) {
                System.err.println("No remote storage configured");
                return 1;
            }
            Path database = context.databasePath(config);
            try {
                BackupOutcome outcome = new BackupCoordinator(storage.get()).backup(database, config.sync().remoteName());
                System.out.println(outcome == BackupOutcome.UPLOADED
                    ? "Uploaded " + database + " as " + config.sync().remoteName()
                    : "No change since last backup");
            } finally {
                StorageSupport.close(storage.get());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Backup failed: " + e.getMessage());
            return 1;
        }
    }
}
