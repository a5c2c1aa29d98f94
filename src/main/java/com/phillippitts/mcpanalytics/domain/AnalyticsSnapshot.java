package com.phillippitts.mcpanalytics.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable point-in-time copy of the analytics aggregate.
 *
 * <p>This is the unit that is persisted, recovered and summarized. Keyed tallies keep their
 * insertion order so a saved snapshot re-saves to the same document.
 *
 * @param startTime                 First start of the server; preserved across recoveries
 * @param totalRequests             Cumulative request count
 * @param totalToolCalls            Cumulative tool-call count
 * @param requestsByMethod          Requests per HTTP method
 * @param requestsByEndpoint        Requests per logical endpoint
 * @param toolCallsByTool           Tool calls per tool name
 * @param requestsByClientIp        Requests per client identity
 * @param requestsByUserAgentPrefix Requests per truncated user agent
 * @param requestsByHour            Requests per UTC hour bucket ({@code yyyy-MM-ddTHH})
 * @param recentToolCalls           Most recent tool calls, newest first
 */
public record AnalyticsSnapshot(
        Instant startTime,
        long totalRequests,
        long totalToolCalls,
        Map<String, Long> requestsByMethod,
        Map<String, Long> requestsByEndpoint,
        Map<String, Long> toolCallsByTool,
        Map<String, Long> requestsByClientIp,
        Map<String, Long> requestsByUserAgentPrefix,
        Map<String, Long> requestsByHour,
        List<ToolCallRecord> recentToolCalls
) {

    public AnalyticsSnapshot {
        Objects.requireNonNull(startTime, "Start time must not be null");
        if (totalRequests < 0 || totalToolCalls < 0) {
            throw new IllegalArgumentException(
                    "Totals must be non-negative, got: " + totalRequests + ", " + totalToolCalls);
        }
        requestsByMethod = orderedCopy(requestsByMethod);
        requestsByEndpoint = orderedCopy(requestsByEndpoint);
        toolCallsByTool = orderedCopy(toolCallsByTool);
        requestsByClientIp = orderedCopy(requestsByClientIp);
        requestsByUserAgentPrefix = orderedCopy(requestsByUserAgentPrefix);
        requestsByHour = orderedCopy(requestsByHour);
        recentToolCalls = recentToolCalls == null ? List.of() : List.copyOf(recentToolCalls);
    }

    /**
     * Creates a snapshot with zeroed counters.
     *
     * @param startTime server start time
     * @return empty snapshot
     */
    public static AnalyticsSnapshot empty(Instant startTime) {
        return new AnalyticsSnapshot(startTime, 0, 0, null, null, null, null, null, null, null);
    }

    private static Map<String, Long> orderedCopy(Map<String, Long> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
