package com.phillippitts.mcpanalytics.exception;

/**
 * Thrown when an analytics import payload is missing both totals or carries a negative value.
 * Nothing is applied when this is thrown.
 */
public class InvalidImportException extends AnalyticsException {

    private final String reason;

    public InvalidImportException(String reason) {
        super("Invalid analytics import: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
