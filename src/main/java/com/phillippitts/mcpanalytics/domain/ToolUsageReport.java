package com.phillippitts.mcpanalytics.domain;

import java.util.List;

/**
 * Tool usage detail served by {@code GET /analytics/tools}.
 *
 * @param totalToolCalls Cumulative tool-call count
 * @param tools          Every tool seen, by descending call count
 * @param recentCalls    Most recent tool calls, newest first
 */
public record ToolUsageReport(
        long totalToolCalls,
        List<ToolCount> tools,
        List<ToolCallRecord> recentCalls
) {

    public record ToolCount(String name, long count) {
    }
}
