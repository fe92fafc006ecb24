package io.cronos.core.sync;

public enum SyncState {
    RUNNING,
    STOPPING,
    STOPPED
}
