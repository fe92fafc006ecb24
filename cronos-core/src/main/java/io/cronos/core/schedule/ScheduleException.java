package io.cronos.core.schedule;

public class ScheduleException extends IllegalArgumentException {
    private final String expression;

    public ScheduleException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public ScheduleException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
