package com.phillippitts.mcpanalytics.exception;

/**
 * Thrown by the counter store when an event cannot be recorded (e.g. missing method or tool name).
 * Never escapes the telemetry service; callers' request handling is unaffected.
 */
public class RecordingException extends AnalyticsException {

    private final String eventKind;

    public RecordingException(String eventKind, String message) {
        super(message + " (event: " + eventKind + ")");
        this.eventKind = eventKind;
    }

    public String getEventKind() {
        return eventKind;
    }
}
