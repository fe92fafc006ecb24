package io.cronos.core.executor;

import io.cronos.core.cron.JobType;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class BackupJobExecutor extends AbstractJobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(BackupJobExecutor.class);

    public BackupJobExecutor() {
        this(JobAction.NOOP);
    }

    public BackupJobExecutor(JobAction action) {
        super(JobType.BACKUP, List.of("path", "destination"), action);
    }

    @Override
    protected void dispatch(Map<String, String> arguments, Map<String, Object> config) {
        LOG.info("Backing up path={} destination={}", arguments.get("path"), arguments.get("destination"));
    }
}
