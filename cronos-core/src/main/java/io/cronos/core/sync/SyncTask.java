package io.cronos.core.sync;

@FunctionalInterface
public interface SyncTask {
    void run() throws Exception;
}
