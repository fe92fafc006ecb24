package io.cronos.cli;

import io.cronos.core.config.model.CronosConfig;
import io.cronos.core.cron.CronManager;
import io.cronos.core.cron.Job;
import io.cronos.core.cron.JobType;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "add", description = "Add a job to the database, or replace one with --id")
public final class AddCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--id", description = "Job id; generated when omitted")
    String id;

    @Option(names = "--name", required = true, description = "Job name")
    String name;

    @Option(names = "--type", required = true, description = "email, sync, backup or custom")
    String type;

    @Option(names = "--schedule", required = true, description = "Six-field cron expression or macro")
    String schedule;

    @Option(names = "--config", description = "Config entry key=value, repeatable")
    Map<String, String> config = new LinkedHashMap<>();

    @Option(names = "--disabled", description = "Store the job without scheduling it")
    boolean disabled;

    public AddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronosConfig cronosConfig = context.loadConfig();
            CronManager manager = context.openRegistry(cronosConfig);
            Job job = Job.of(name, JobType.fromValue(type), schedule, new LinkedHashMap<String, Object>(config))
                .withId(id)
                .withEnabled(!disabled);
            Job stored = manager.addJob(job);
            manager.saveAll();
            System.out.println("Added job " + stored.id() + " (" + stored.scheduleDesc() + ")");
            return 0;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid job: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Add command failed: " + e.getMessage());
            return 1;
        }
    }
}
