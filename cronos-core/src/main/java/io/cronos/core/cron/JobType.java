package io.cronos.core.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum JobType {
    EMAIL("email"),
    SYNC("sync"),
    BACKUP("backup"),
    CUSTOM("custom");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static JobType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new JobValidationException("job type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (JobType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new JobValidationException("unknown job type: " + raw);
    }
}
