package io.cronos.core.persistence;

import io.cronos.core.cron.Job;

public record StoredJob(String id, Job job, String error) {

    public static StoredJob decoded(Job job) {
        return new StoredJob(job.id(), job, null);
    }

    public static StoredJob failed(String id, String error) {
        return new StoredJob(id, null, error);
    }

    public boolean isDecoded() {
        return job != null;
    }
}
