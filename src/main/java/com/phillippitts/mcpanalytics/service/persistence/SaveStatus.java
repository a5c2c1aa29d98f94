package com.phillippitts.mcpanalytics.service.persistence;

/**
 * Outcome of one snapshot save.
 */
public enum SaveStatus {
    SAVED,
    FAILED
}
