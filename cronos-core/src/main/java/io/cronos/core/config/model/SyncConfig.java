package io.cronos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncConfig(
    long saveIntervalSeconds,
    long backupIntervalSeconds,
    String remoteName,
    boolean restoreOnStart
) {

    public static SyncConfig defaults() {
        return new SyncConfig(30, 3600, "cronos_backups/cron_jobs.db", true);
    }

    @JsonIgnore
    public Duration saveInterval() {
        return Duration.ofSeconds(Math.max(1, saveIntervalSeconds));
    }

    @JsonIgnore
    public Duration backupInterval() {
        return Duration.ofSeconds(Math.max(1, backupIntervalSeconds));
    }
}
