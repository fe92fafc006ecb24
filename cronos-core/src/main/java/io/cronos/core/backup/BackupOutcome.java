package io.cronos.core.backup;

public enum BackupOutcome {
    UPLOADED,
    SKIPPED
}
