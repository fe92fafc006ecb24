package io.cronos.core.executor;

import io.cronos.core.cron.JobType;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EmailJobExecutor extends AbstractJobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(EmailJobExecutor.class);

    public EmailJobExecutor() {
        this(JobAction.NOOP);
    }

    public EmailJobExecutor(JobAction action) {
        super(JobType.EMAIL, List.of("to", "subject"), action);
    }

    @Override
    protected void dispatch(Map<String, String> arguments, Map<String, Object> config) {
        // body stays out of the log
        LOG.info("Sending email to={} subject={} hasBody={}", arguments.get("to"), arguments.get("subject"), config.containsKey("body"));
    }
}
