package com.phillippitts.mcpanalytics.domain;

/**
 * Cumulative totals after an import was applied.
 */
public record ImportResult(long totalRequests, long totalToolCalls) {
}
