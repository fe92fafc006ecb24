package io.cronos.core.executor;

import io.cronos.core.cron.JobType;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SyncJobExecutor extends AbstractJobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(SyncJobExecutor.class);

    public SyncJobExecutor() {
        this(JobAction.NOOP);
    }

    public SyncJobExecutor(JobAction action) {
        super(JobType.SYNC, List.of("source", "destination"), action);
    }

    @Override
    protected void dispatch(Map<String, String> arguments, Map<String, Object> config) {
        LOG.info("Syncing data source={} destination={}", arguments.get("source"), arguments.get("destination"));
    }
}
