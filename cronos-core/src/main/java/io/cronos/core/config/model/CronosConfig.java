package io.cronos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CronosConfig(
    String database,
    SyncConfig sync,
    StorageConfig storage,
    SchedulerConfig scheduler
) {

    public static CronosConfig defaults() {
        return new CronosConfig(
            "cron_jobs.db",
            SyncConfig.defaults(),
            StorageConfig.defaults(),
            SchedulerConfig.defaults()
        );
    }
}
