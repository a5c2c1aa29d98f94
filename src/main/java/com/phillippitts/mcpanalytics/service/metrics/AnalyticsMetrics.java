package com.phillippitts.mcpanalytics.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.LongSupplier;

/**
 * Operational metrics for the analytics engine itself.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Snapshot load and save outcomes</li>
 *   <li>Events that could not be recorded, per event kind</li>
 *   <li>Rejected analytics imports</li>
 *   <li>Cumulative request and tool-call totals as gauges</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class AnalyticsMetrics {

    private static final String METRIC_PREFIX = "mcpanalytics";

    private final MeterRegistry registry;

    public AnalyticsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a snapshot load by outcome.
     *
     * @param outcome load outcome (restored, no_snapshot, failed)
     */
    public void recordSnapshotLoad(Enum<?> outcome) {
        Counter.builder(METRIC_PREFIX + ".snapshot.load")
                .description("Number of analytics snapshot loads")
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .increment();
    }

    /**
     * Counts a snapshot save by outcome.
     *
     * @param outcome save outcome (saved, failed)
     */
    public void recordSnapshotSave(Enum<?> outcome) {
        Counter.builder(METRIC_PREFIX + ".snapshot.save")
                .description("Number of analytics snapshot saves")
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .increment();
    }

    /**
     * Increments the counter of events that could not be recorded.
     *
     * @param eventKind kind of event (request, tool-call)
     */
    public void incrementRecordingFailure(String eventKind) {
        Counter.builder(METRIC_PREFIX + ".recording.failure")
                .description("Number of events that could not be recorded")
                .tag("event", eventKind)
                .register(registry)
                .increment();
    }

    /**
     * Increments the counter of rejected analytics imports.
     */
    public void incrementImportRejected() {
        Counter.builder(METRIC_PREFIX + ".import.rejected")
                .description("Number of rejected analytics imports")
                .register(registry)
                .increment();
    }

    /**
     * Registers gauges reading the cumulative totals.
     *
     * @param totalRequests  supplier of the cumulative request count
     * @param totalToolCalls supplier of the cumulative tool-call count
     */
    public void bindTotals(LongSupplier totalRequests, LongSupplier totalToolCalls) {
        Gauge.builder(METRIC_PREFIX + ".requests.total", totalRequests, s -> (double) s.getAsLong())
                .description("Cumulative requests, including imported counts")
                .strongReference(true)
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".toolcalls.total", totalToolCalls, s -> (double) s.getAsLong())
                .description("Cumulative tool calls, including imported counts")
                .strongReference(true)
                .register(registry);
    }

    private static String tagValue(Enum<?> outcome) {
        return outcome.name().toLowerCase(Locale.ROOT);
    }
}
