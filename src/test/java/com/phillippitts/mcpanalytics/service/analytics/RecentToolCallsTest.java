package com.phillippitts.mcpanalytics.service.analytics;

import com.phillippitts.mcpanalytics.domain.ToolCallRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecentToolCallsTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private static ToolCallRecord call(int i) {
        return new ToolCallRecord("tool-" + i, T0.plusSeconds(i), "10.0.0.1", "node");
    }

    @Test
    void keepsNewestRecordsUpToCapacity() {
        RecentToolCalls ring = new RecentToolCalls(100);

        for (int i = 0; i < 150; i++) {
            ring.add(call(i));
        }

        List<ToolCallRecord> records = ring.toList();
        assertThat(records).hasSize(100);
        assertThat(records.get(0).tool()).isEqualTo("tool-149");
        assertThat(records.get(99).tool()).isEqualTo("tool-50");
    }

    @Test
    void replaceWithKeepsLeadingEntries() {
        RecentToolCalls ring = new RecentToolCalls(3);
        ring.add(call(99));
        List<ToolCallRecord> newestFirst = new ArrayList<>();
        for (int i = 9; i >= 0; i--) {
            newestFirst.add(call(i));
        }

        ring.replaceWith(newestFirst);

        assertThat(ring.toList()).extracting(ToolCallRecord::tool)
                .containsExactly("tool-9", "tool-8", "tool-7");
    }

    @Test
    void toListIsACopy() {
        RecentToolCalls ring = new RecentToolCalls(5);
        ring.add(call(1));

        List<ToolCallRecord> copy = ring.toList();
        ring.add(call(2));

        assertThat(copy).hasSize(1);
        assertThat(ring.size()).isEqualTo(2);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RecentToolCalls(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Capacity must be positive");
    }
}
