package io.cronos.cli;

import io.cronos.core.cron.CronManager;
import io.cronos.core.cron.JobNotFoundException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Remove a job from the database")
public final class RemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    String id;

    public RemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronManager manager = context.openRegistry(context.loadConfig());
            manager.removeJob(id);
            manager.saveAll();
            System.out.println("Removed job " + id);
            return 0;
        } catch (JobNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Remove command failed: " + e.getMessage());
            return 1;
        }
    }
}
