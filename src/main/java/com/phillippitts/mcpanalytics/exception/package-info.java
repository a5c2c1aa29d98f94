/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend a common base so the presentation layer can map them to HTTP
 * responses in one place, and so the analytics engine can name each failure path it absorbs.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mcpanalytics.exception.AnalyticsException} - Base exception</li>
 *   <li>{@link com.phillippitts.mcpanalytics.exception.SnapshotLoadException} - Snapshot file
 *       unreadable or structurally invalid; absorbed, a fresh snapshot is used</li>
 *   <li>{@link com.phillippitts.mcpanalytics.exception.SnapshotSaveException} - Snapshot write
 *       failed; absorbed, retried on the next flush</li>
 *   <li>{@link com.phillippitts.mcpanalytics.exception.InvalidImportException} - Import payload
 *       rejected; surfaced to the client as HTTP 400</li>
 *   <li>{@link com.phillippitts.mcpanalytics.exception.RecordingException} - Event could not be
 *       recorded; absorbed by the telemetry service</li>
 * </ul>
 *
 * @see com.phillippitts.mcpanalytics.exception.AnalyticsException
 * @see com.phillippitts.mcpanalytics.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.mcpanalytics.exception;
