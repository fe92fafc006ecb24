package io.cronos.core.executor;

import io.cronos.core.cron.JobType;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CustomJobExecutor extends AbstractJobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(CustomJobExecutor.class);

    public CustomJobExecutor() {
        this(JobAction.NOOP);
    }

    public CustomJobExecutor(JobAction action) {
        super(JobType.CUSTOM, List.of("command"), action);
    }

    @Override
    protected void dispatch(Map<String, String> arguments, Map<String, Object> config) {
        LOG.info("Executing custom command={}", arguments.get("command"));
    }
}
