package io.cronos.core.executor;

import io.cronos.core.cron.JobType;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JobExecutors {
    private final Map<JobType, JobExecutor> executors = new EnumMap<>(JobType.class);

    public static JobExecutors defaults() {
        return withActions(Map.of());
    }

    public static JobExecutors withActions(Map<JobType, JobAction> actions) {
        JobExecutors registry = new JobExecutors();
        registry.register(new EmailJobExecutor(actions.getOrDefault(JobType.EMAIL, JobAction.NOOP)));
        registry.register(new SyncJobExecutor(actions.getOrDefault(JobType.SYNC, JobAction.NOOP)));
        registry.register(new BackupJobExecutor(actions.getOrDefault(JobType.BACKUP, JobAction.NOOP)));
        registry.register(new CustomJobExecutor(actions.getOrDefault(JobType.CUSTOM, JobAction.NOOP)));
        return registry;
    }

    public synchronized JobExecutors register(JobExecutor executor) {
        executors.put(executor.type(), executor);
        return this;
    }

    public synchronized Optional<JobExecutor> find(JobType type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(executors.get(type));
    }

    public synchronized Collection<JobExecutor> all() {
        return List.copyOf(executors.values());
    }
}
