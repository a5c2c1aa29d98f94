package com.phillippitts.mcpanalytics.domain;

/**
 * Externally supplied counts to add on top of the current cumulative totals.
 * Either field may be absent, but not both.
 *
 * @param totalRequests  requests to add, or null
 * @param totalToolCalls tool calls to add, or null
 */
public record ImportDelta(Long totalRequests, Long totalToolCalls) {
}
