package com.phillippitts.mcpanalytics.exception;

import java.nio.file.Path;

/**
 * Thrown when an existing snapshot file cannot be read or is not a JSON object.
 * Recoverable: the caller falls back to a fresh snapshot.
 */
public class SnapshotLoadException extends AnalyticsException {

    private final Path snapshotFile;

    public SnapshotLoadException(Path snapshotFile, String reason) {
        super("Failed to load analytics snapshot " + snapshotFile + ": " + reason);
        this.snapshotFile = snapshotFile;
    }

    public SnapshotLoadException(Path snapshotFile, String reason, Throwable cause) {
        super("Failed to load analytics snapshot " + snapshotFile + ": " + reason, cause);
        this.snapshotFile = snapshotFile;
    }

    public Path getSnapshotFile() {
        return snapshotFile;
    }
}
