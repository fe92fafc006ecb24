package io.cronos.core.executor;

import io.cronos.core.cron.JobType;
import io.cronos.core.cron.JobValidationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public abstract class AbstractJobExecutor implements JobExecutor {
    private final JobType type;
    private final List<String> requiredKeys;
    private final JobAction action;

    protected AbstractJobExecutor(JobType type, List<String> requiredKeys, JobAction action) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.requiredKeys = List.copyOf(requiredKeys);
        this.action = action == null ? JobAction.NOOP : action;
    }

    @Override
    public final JobType type() {
        return type;
    }

    public final List<String> requiredKeys() {
        return requiredKeys;
    }

    @Override
    public final void validate(Map<String, Object> config) {
        for (String key : requiredKeys) {
            if (config == null || config.get(key) == null) {
                throw new JobValidationException(
                    "job configuration validation failed: '" + key + "' field is required for " + type.value() + " jobs",
                    key
                );
            }
        }
    }

    @Override
    public final void execute(Map<String, Object> config) throws Exception {
        Map<String, String> arguments = new LinkedHashMap<>();
        for (String key : requiredKeys) {
            arguments.put(key, String.valueOf(config.get(key)));
        }
        dispatch(arguments, config);
        action.perform(config);
    }

    protected abstract void dispatch(Map<String, String> arguments, Map<String, Object> config);
}
