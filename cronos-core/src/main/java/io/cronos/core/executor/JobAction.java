package io.cronos.core.executor;

import java.util.Map;

@FunctionalInterface
public interface JobAction {
    JobAction NOOP = config -> {
    };

    void perform(Map<String, Object> config) throws Exception;
}
