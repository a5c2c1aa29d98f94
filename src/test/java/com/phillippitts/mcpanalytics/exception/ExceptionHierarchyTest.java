package com.phillippitts.mcpanalytics.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    private static final Path FILE = Path.of("/data/analytics.json");

    @Test
    void allAnalyticsErrorsShareOneRoot() {
        assertThat(new SnapshotLoadException(FILE, "bad")).isInstanceOf(AnalyticsException.class);
        assertThat(new SnapshotSaveException(FILE, new IOException("x"))).isInstanceOf(AnalyticsException.class);
        assertThat(new InvalidImportException("bad")).isInstanceOf(AnalyticsException.class);
        assertThat(new RecordingException("request", "bad")).isInstanceOf(AnalyticsException.class);
        assertThat(new AnalyticsException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void snapshotErrorsCarryTheFile() {
        IOException cause = new IOException("disk full");
        SnapshotSaveException save = new SnapshotSaveException(FILE, cause);
        SnapshotLoadException load = new SnapshotLoadException(FILE, "file is empty");

        assertThat(save.getSnapshotFile()).isEqualTo(FILE);
        assertThat(save.getCause()).isSameAs(cause);
        assertThat(save.getMessage()).contains(FILE.toString());
        assertThat(load.getSnapshotFile()).isEqualTo(FILE);
        assertThat(load.getMessage()).endsWith("file is empty");
    }

    @Test
    void invalidImportKeepsReason() {
        InvalidImportException ex = new InvalidImportException("totalRequests must be non-negative, got -5");

        assertThat(ex.getReason()).isEqualTo("totalRequests must be non-negative, got -5");
        assertThat(ex.getMessage()).startsWith("Invalid analytics import: ");
    }

    @Test
    void recordingErrorNamesEventKind() {
        RecordingException ex = new RecordingException("tool-call", "Tool name is required");

        assertThat(ex.getEventKind()).isEqualTo("tool-call");
        assertThat(ex.getMessage()).isEqualTo("Tool name is required (event: tool-call)");
    }
}
