package com.phillippitts.mcpanalytics.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only analytics view served by {@code GET /analytics}.
 *
 * @param server          Server display name
 * @param serverStartTime First start of the server
 * @param uptime          Human-readable time since {@code serverStartTime}
 * @param summary         Cumulative totals
 * @param breakdown       Requests by method and endpoint, tool calls by tool (descending)
 * @param clients         Top clients by request count and requests by user agent
 * @param hourlyRequests  Most recent hour buckets, oldest first
 * @param recentToolCalls Most recent tool calls, newest first
 */
public record AnalyticsSummary(
        String server,
        Instant serverStartTime,
        String uptime,
        Totals summary,
        Breakdown breakdown,
        Clients clients,
        Map<String, Long> hourlyRequests,
        List<ToolCallRecord> recentToolCalls
) {

    public record Totals(long totalRequests, long totalToolCalls, int uniqueClients) {
    }

    public record Breakdown(
            Map<String, Long> byMethod,
            Map<String, Long> byEndpoint,
            Map<String, Long> byTool
    ) {
    }

    public record Clients(Map<String, Long> byIp, Map<String, Long> byUserAgent) {
    }
}
