package io.cronos.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Run the scheduler with background save and backup until interrupted")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--skip-restore", description = "Do not restore the database from remote storage on start")
    boolean skipRestore;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serveRunner().run(!skipRestore);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
