package io.cronos.cli;

import io.cronos.core.backup.BackupCoordinator;
import io.cronos.core.config.model.CronosConfig;
import io.cronos.core.storage.Storage;
import io.cronos.core.storage.StorageFactory;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "restore", description = "Replace the job database with the remote backup")
public final class RestoreCommand implements Callable<Integer> {
    private final CliContext context;

    public RestoreCommand(CliContext context) {
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
            boolean restored;
            try {
                restored = new BackupCoordinator(storage.get()).restore(database, config.sync().remoteName());
            } finally {
                StorageSupport.close(storage.get());
            }
            if (!restored) {
                System.out.println("Nothing restored; local database left unchanged");
                return 1;
            }
            System.out.println("Restored " + database + " from " + config.sync().remoteName());
            return 0;
        } catch (Exception e) {
            System.err.println("Restore failed: " + e.getMessage());
            return 1;
        }
    }
}
