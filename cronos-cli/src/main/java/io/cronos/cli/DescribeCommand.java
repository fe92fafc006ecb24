package io.cronos.cli;

import io.cronos.core.schedule.CronSchedule;
import io.cronos.core.schedule.ScheduleException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "describe", description = "Validate a cron expression and print it in plain English")
public final class DescribeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Six-field cron expression or macro such as @daily")
    String expression;

    @Option(names = "--zone", description = "Time zone for the next occurrence")
    ZoneId zone;

    @Override
    public Integer call() {
        try {
            CronSchedule schedule = CronSchedule.parse(expression);
            System.out.println(schedule.description());
            ZoneId effectiveZone = zone == null ? ZoneId.systemDefault() : zone;
            schedule.nextAfter(Instant.now(), effectiveZone)
                .ifPresent(next -> System.out.println("Next run: " + next.atZone(effectiveZone)));
            return 0;
        } catch (ScheduleException e) {
            System.err.println("Invalid schedule: " + e.getMessage());
            return 1;
        }
    }
}
