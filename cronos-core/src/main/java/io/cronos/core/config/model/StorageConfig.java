package io.cronos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String provider,
    String directory,
    String bucket,
    String region,
    String endpoint,
    String prefix,
    String accessKeyId,
    String secretAccessKey,
    String sessionToken,
    String profile
) {
    public static final String NONE = "none";
    public static final String LOCAL = "local";
    public static final String S3 = "s3";

    public static StorageConfig defaults() {
        return new StorageConfig(NONE, "", "", "", "", "", "", "", "", "");
    }

    public static StorageConfig local(String directory) {
        return new StorageConfig(LOCAL, directory, "", "", "", "", "", "", "", "");
    }

    @JsonIgnore
    public String normalizedProvider() {
        return provider == null || provider.isBlank() ? NONE : provider.trim().toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean configured() {
        return switch (normalizedProvider()) {
            case LOCAL -> directory != null && !directory.isBlank();
            case S3 -> bucket != null && !bucket.isBlank();
            default -> false;
        };
    }
}
