/**
 * Presentation layer (REST API controllers, request tracking and exception handling).
 *
 * <p>Presentation depends on the service layer but not vice versa. Controllers are thin
 * adapters over {@link com.phillippitts.mcpanalytics.service.analytics.TelemetryService}.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.interceptor} - Per-request analytics recording</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.mcpanalytics.presentation;
