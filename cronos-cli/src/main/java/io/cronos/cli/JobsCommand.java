package io.cronos.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronos.core.cron.CronManager;
import io.cronos.core.cron.JobNotFoundException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "jobs", description = "Print stored jobs as JSON, most recently run first")
public final class JobsCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Option(names = "--id", description = "Print only the job with this id")
    String id;

    public JobsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronManager manager = context.openRegistry(context.loadConfig());
            Object output = id == null ? manager.listJobs() : manager.getJob(id);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(output));
            return 0;
        } catch (JobNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Jobs command failed: " + e.getMessage());
            return 1;
        }
    }
}
