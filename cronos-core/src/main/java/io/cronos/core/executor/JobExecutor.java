package io.cronos.core.executor;

import io.cronos.core.cron.JobType;
import java.util.Map;

public interface JobExecutor {
    JobType type();

    void validate(Map<String, Object> config);

    void execute(Map<String, Object> config) throws Exception;
}
