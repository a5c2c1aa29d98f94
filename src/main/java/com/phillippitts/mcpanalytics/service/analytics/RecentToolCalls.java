package com.phillippitts.mcpanalytics.service.analytics;

import com.phillippitts.mcpanalytics.domain.ToolCallRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded newest-first feed of tool calls. Adding beyond capacity evicts the oldest record
 * in the same step, so readers never observe an over-capacity or half-updated feed.
 */
final class RecentToolCalls {

    private final int capacity;
    private final Deque<ToolCallRecord> records;

    RecentToolCalls(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.records = new ArrayDeque<>(capacity + 1);
    }

    int capacity() {
        return capacity;
    }

    synchronized int size() {
        return records.size();
    }

    synchronized void add(ToolCallRecord record) {
        records.addFirst(record);
        while (records.size() > capacity) {
            records.removeLast();
        }
    }

    /**
     * Replaces the contents with {@code newestFirst}, keeping at most {@link #capacity()} of the newest.
     */
    synchronized void replaceWith(List<ToolCallRecord> newestFirst) {
        records.clear();
        for (ToolCallRecord record : newestFirst) {
            if (records.size() == capacity) {
                break;
            }
            records.addLast(record);
        }
    }

    /** Newest-first copy. */
    synchronized List<ToolCallRecord> toList() {
        return new ArrayList<>(records);
    }
}
