package io.cronos.core.config;

import java.nio.file.Path;

public record InitResult(Path configPath, boolean createdConfig, boolean overwrittenConfig) {
}
