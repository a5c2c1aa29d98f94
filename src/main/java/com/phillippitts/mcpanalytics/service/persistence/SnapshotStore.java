package com.phillippitts.mcpanalytics.service.persistence;

import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;
import com.phillippitts.mcpanalytics.exception.SnapshotLoadException;
import com.phillippitts.mcpanalytics.exception.SnapshotSaveException;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable storage for the analytics snapshot.
 *
 * <p>Implementations report failures with the named snapshot exceptions only;
 * {@link SnapshotPersistence} decides how each one is absorbed.
 */
public interface SnapshotStore {

    /**
     * Reads the stored snapshot.
     *
     * @param fallbackStartTime start time to use if the stored one is missing or malformed
     * @return the recovered snapshot, or empty if nothing has been stored yet
     * @throws SnapshotLoadException if stored data exists but cannot be read or decoded
     */
    Optional<AnalyticsSnapshot> read(Instant fallbackStartTime);

    /**
     * Replaces the stored snapshot.
     *
     * @param snapshot snapshot to store
     * @throws SnapshotSaveException if the snapshot could not be written
     */
    void write(AnalyticsSnapshot snapshot);

    /**
     * Human-readable location for logs and health details.
     */
    String location();
}
