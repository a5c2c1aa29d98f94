package com.phillippitts.mcpanalytics.exception;

import java.nio.file.Path;

/**
 * Thrown when the snapshot cannot be written (directory creation, permissions, disk full).
 * Recoverable: in-memory state is kept and the next scheduled flush retries.
 */
public class SnapshotSaveException extends AnalyticsException {

    private final Path snapshotFile;

    public SnapshotSaveException(Path snapshotFile, Throwable cause) {
        super("Failed to save analytics snapshot " + snapshotFile, cause);
        this.snapshotFile = snapshotFile;
    }

    public Path getSnapshotFile() {
        return snapshotFile;
    }
}
