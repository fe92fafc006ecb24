package io.cronos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(String zone, long shutdownGraceSeconds) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("", 10);
    }

    @JsonIgnore
    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }

    @JsonIgnore
    public Duration shutdownGrace() {
        return Duration.ofSeconds(Math.max(0, shutdownGraceSeconds));
    }
}
