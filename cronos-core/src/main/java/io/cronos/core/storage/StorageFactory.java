package io.cronos.core.storage;

import io.cronos.core.config.ConfigPaths;
import io.cronos.core.config.model.StorageConfig;
import java.nio.file.Path;
import java.util.Optional;

public final class StorageFactory {

    private StorageFactory() {
    }

    public static Optional<Storage> create(StorageConfig config, Path baseDir) {
        if (config == null || !config.configured()) {
            return Optional.empty();
        }
        return switch (config.normalizedProvider()) {
            case StorageConfig.LOCAL -> Optional.of(new LocalDirectoryStorage(ConfigPaths.resolve(config.directory(), baseDir)));
            case StorageConfig.S3 -> Optional.of(new S3Storage(config));
            default -> throw new IllegalArgumentException("unsupported storage provider: " + config.provider());
        };
    }
}
