package com.phillippitts.mcpanalytics.service.health;

import com.phillippitts.mcpanalytics.service.persistence.SaveStatus;
import com.phillippitts.mcpanalytics.service.persistence.SnapshotPersistence;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Health indicator for analytics snapshot persistence.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: No save attempted yet, or the last save succeeded</li>
 *   <li>DEGRADED: The last save failed; counters are still served from memory</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SnapshotPersistenceHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final SnapshotPersistence persistence;

    public SnapshotPersistenceHealthIndicator(SnapshotPersistence persistence) {
        this.persistence = persistence;
    }

    @Override
    public Health health() {
        boolean lastSaveFailed = persistence.lastSaveStatus()
                .map(status -> status == SaveStatus.FAILED)
                .orElse(false);

        Health.Builder builder = lastSaveFailed
                ? new Health.Builder().status(DEGRADED).withDetail("status", "Last snapshot save failed")
                : new Health.Builder().up().withDetail("status", "Snapshot persistence operational");

        builder.withDetail("file", persistence.location())
                .withDetail("lastSave", persistence.lastSaveStatus()
                        .map(s -> s.name().toLowerCase(Locale.ROOT))
                        .orElse("none"));
        persistence.lastSuccessfulSave()
                .ifPresent(at -> builder.withDetail("lastSuccessfulSave", at.toString()));
        return builder.build();
    }
}
