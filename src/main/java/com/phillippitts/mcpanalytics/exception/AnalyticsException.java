package com.phillippitts.mcpanalytics.exception;

/**
 * Base exception for all mcp-analytics application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnalyticsException(Throwable cause) {
        super(cause);
    }
}
