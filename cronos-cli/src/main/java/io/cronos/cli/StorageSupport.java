package io.cronos.cli;

import io.cronos.core.storage.Storage;

final class StorageSupport {

    private StorageSupport() {
    }

    static void close(Storage storage) throws Exception {
        if (storage instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}
