package com.phillippitts.mcpanalytics.service.persistence;

/**
 * How the startup snapshot load ended.
 */
public enum LoadStatus {
    /** A stored snapshot was found and recovered (malformed fields defaulted individually). */
    RESTORED,
    /** Nothing stored yet; started from a fresh snapshot. */
    NO_SNAPSHOT,
    /** A stored snapshot exists but could not be read; started from a fresh snapshot. */
    FAILED
}
