package com.phillippitts.mcpanalytics.service.analytics;

import com.phillippitts.mcpanalytics.domain.AnalyticsSummary;
import com.phillippitts.mcpanalytics.domain.ImportDelta;
import com.phillippitts.mcpanalytics.domain.ImportResult;
import com.phillippitts.mcpanalytics.domain.RequestContext;
import com.phillippitts.mcpanalytics.domain.ToolUsageReport;
import com.phillippitts.mcpanalytics.exception.InvalidImportException;

/**
 * The analytics engine as seen by the HTTP layer.
 *
 * <p>Recording is synchronous and in-memory; persistence happens in the background and on
 * shutdown. Implementations own the aggregate exclusively.
 */
public interface TelemetryService {

    /**
     * Recovers the persisted aggregate and starts the periodic flush. Called once per process.
     */
    void initialize();

    /**
     * Counts one inbound request. Never throws.
     *
     * @param context what is known about the request
     */
    void recordRequest(RequestContext context);

    /**
     * Counts one tool invocation. Never throws.
     *
     * @param toolName name of the invoked tool
     * @param context  the request that carried the invocation
     */
    void recordToolCall(String toolName, RequestContext context);

    /**
     * Summary of everything recorded so far.
     */
    AnalyticsSummary summarize();

    /**
     * Per-tool counts and the longer recent-call feed.
     */
    ToolUsageReport recentToolUsage();

    /**
     * Adds externally supplied counts to the cumulative totals and saves immediately.
     *
     * @param delta counts to add
     * @return totals after the import
     * @throws InvalidImportException if both counts are absent or either is negative;
     *                                nothing is applied in that case
     */
    ImportResult importDelta(ImportDelta delta);

    /**
     * Stops the periodic flush and writes a final snapshot. Later calls do nothing.
     */
    void shutdown();
}
