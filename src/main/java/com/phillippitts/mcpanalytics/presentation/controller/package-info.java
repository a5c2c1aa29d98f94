/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /}, {@code GET /health} - Server identity and liveness</li>
 *   <li>{@code GET /analytics}, {@code GET /analytics/tools} - Analytics views</li>
 *   <li>{@code GET /analytics/dashboard} - HTML charts over the summary view</li>
 *   <li>{@code POST /analytics/import} - Adds externally kept totals</li>
 *   <li>{@code GET|POST|DELETE /mcp} - Protocol endpoint, tool calls counted on the way in</li>
 * </ul>
 *
 * <p>Every route is counted by
 * {@link com.phillippitts.mcpanalytics.presentation.interceptor.RequestTrackingInterceptor};
 * exceptions are mapped by {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.mcpanalytics.presentation.controller;
