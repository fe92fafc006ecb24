package io.cronos.core.cron;

public class JobValidationException extends IllegalArgumentException {
    private final String missingKey;

    public JobValidationException(String message) {
        this(message, null);
    }

    public JobValidationException(String message, String missingKey) {
        super(message);
        this.missingKey = missingKey;
    }

    public String missingKey() {
        return missingKey;
    }
}
