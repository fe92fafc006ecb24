package io.cronos.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".cronos", "config.json");
    }

    public static Path resolve(String rawPath, Path base) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        Path path = Path.of(rawPath);
        if (path.isAbsolute() || base == null) {
            return path;
        }
        return base.resolve(path);
    }
}
