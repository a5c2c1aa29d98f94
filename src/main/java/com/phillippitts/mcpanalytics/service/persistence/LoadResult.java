package com.phillippitts.mcpanalytics.service.persistence;

import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;

import java.util.Objects;

/**
 * Snapshot to install at startup together with how it was obtained.
 *
 * @param snapshot recovered or fresh snapshot, never null
 * @param status   which load path was taken
 */
public record LoadResult(AnalyticsSnapshot snapshot, LoadStatus status) {

    public LoadResult {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(status, "status");
    }
}
