package com.phillippitts.mcpanalytics.service.persistence;

import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;
import com.phillippitts.mcpanalytics.exception.SnapshotLoadException;
import com.phillippitts.mcpanalytics.exception.SnapshotSaveException;
import com.phillippitts.mcpanalytics.service.metrics.AnalyticsMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Best-effort durability for the analytics snapshot.
 *
 * <p>Neither {@link #load()} nor {@link #save} throws: a {@link SnapshotLoadException} degrades
 * to a fresh snapshot and a {@link SnapshotSaveException} leaves the stored file as it was
 * until the next save. Both outcomes are logged, counted and returned so callers and tests can
 * tell which path was taken.
 *
 * <p>Saves are serialized; the periodic flush, an import and the shutdown flush may overlap.
 */
public class SnapshotPersistence {

    private static final Logger LOG = LogManager.getLogger(SnapshotPersistence.class);

    private final SnapshotStore store;
    private final AnalyticsMetrics metrics;
    private final Clock clock;

    private volatile SaveStatus lastSaveStatus;
    private volatile Instant lastSuccessfulSave;

    public SnapshotPersistence(SnapshotStore store, AnalyticsMetrics metrics, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Recovers the stored snapshot, or a fresh one started "now" if there is none or it is unreadable.
     */
    public LoadResult load() {
        Instant now = clock.instant();
        LoadResult result;
        try {
            Optional<AnalyticsSnapshot> recovered = store.read(now);
            if (recovered.isPresent()) {
                AnalyticsSnapshot snapshot = recovered.get();
                LOG.info("Loaded analytics from {}: totalRequests={}, totalToolCalls={}, startTime={}",
                        store.location(), snapshot.totalRequests(), snapshot.totalToolCalls(), snapshot.startTime());
                result = new LoadResult(snapshot, LoadStatus.RESTORED);
            } else {
                LOG.info("No existing analytics file at {}, starting fresh", store.location());
                result = new LoadResult(AnalyticsSnapshot.empty(now), LoadStatus.NO_SNAPSHOT);
            }
        } catch (SnapshotLoadException e) {
            LOG.warn("{}; starting with fresh analytics", e.getMessage(), e);
            result = new LoadResult(AnalyticsSnapshot.empty(now), LoadStatus.FAILED);
        }
        metrics.recordSnapshotLoad(result.status());
        return result;
    }

    /**
     * Writes the snapshot, replacing the stored one.
     *
     * @return {@link SaveStatus#SAVED} or {@link SaveStatus#FAILED}
     */
    public SaveStatus save(AnalyticsSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        return save(() -> snapshot);
    }

    /**
     * Takes a snapshot and writes it while holding the save lock, so a later save
     * never stores an older copy than an earlier one.
     *
     * @param snapshotSource supplies the snapshot to write; called once
     * @return {@link SaveStatus#SAVED} or {@link SaveStatus#FAILED}
     */
    public synchronized SaveStatus save(Supplier<AnalyticsSnapshot> snapshotSource) {
        AnalyticsSnapshot snapshot = snapshotSource.get();
        SaveStatus status;
        try {
            store.write(snapshot);
            lastSuccessfulSave = clock.instant();
            status = SaveStatus.SAVED;
            LOG.debug("Saved analytics to {}: totalRequests={}, totalToolCalls={}",
                    store.location(), snapshot.totalRequests(), snapshot.totalToolCalls());
        } catch (SnapshotSaveException e) {
            status = SaveStatus.FAILED;
            LOG.error("{}; in-memory analytics retained until the next save", e.getMessage(), e);
        }
        lastSaveStatus = status;
        metrics.recordSnapshotSave(status);
        return status;
    }

    /** Outcome of the most recent save, empty before the first one. */
    public Optional<SaveStatus> lastSaveStatus() {
        return Optional.ofNullable(lastSaveStatus);
    }

    /** Time of the most recent successful save, empty if none succeeded yet. */
    public Optional<Instant> lastSuccessfulSave() {
        return Optional.ofNullable(lastSuccessfulSave);
    }

    public String location() {
        return store.location();
    }
}
