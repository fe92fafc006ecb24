package io.cronos.core.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
    String id,
    String name,
    JobType type,
    String schedule,
    String scheduleDesc,
    boolean enabled,
    Map<String, Object> config,
    Instant lastRun,
    Instant nextRun
) {

    public Job {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public static Job of(String name, JobType type, String schedule, Map<String, Object> config) {
        return new Job(null, name, type, schedule, null, true, config, null, null);
    }

    public Job withId(String newId) {
        return new Job(newId, name, type, schedule, scheduleDesc, enabled, config, lastRun, nextRun);
    }

    public Job withEnabled(boolean value) {
        return new Job(id, name, type, schedule, scheduleDesc, value, config, lastRun, nextRun);
    }

    public Job withScheduleDesc(String description) {
        return new Job(id, name, type, schedule, description, enabled, config, lastRun, nextRun);
    }

    public Job withLastRun(Instant instant) {
        return new Job(id, name, type, schedule, scheduleDesc, enabled, config, instant, nextRun);
    }

    public Job withNextRun(Instant instant) {
        return new Job(id, name, type, schedule, scheduleDesc, enabled, config, lastRun, instant);
    }
}
