/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.mcpanalytics.exception.InvalidImportException} → 400 Bad Request</li>
 *   <li>{@code HttpMessageNotReadableException} → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidImportException",
 *   "message": "Failed to import analytics",
 *   "details": "totalRequests must be non-negative, got -5",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.mcpanalytics.presentation.exception;
