package com.phillippitts.mcpanalytics.service.analytics;

import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;
import com.phillippitts.mcpanalytics.domain.AnalyticsSummary;
import com.phillippitts.mcpanalytics.domain.ToolCallRecord;
import com.phillippitts.mcpanalytics.domain.ToolUsageReport;
import com.phillippitts.mcpanalytics.util.UptimeFormatter;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collector;
import java.util.stream.Collectors;

/**
 * Derives the read-only analytics views from a snapshot copy.
 *
 * <p>Pure functions of their input; safe to call from any thread.
 */
public class SnapshotSummarizer {

    private final String serverName;
    private final int topClients;
    private final int hourlyBuckets;
    private final int summaryRecentCalls;
    private final int detailRecentCalls;

    public SnapshotSummarizer(String serverName,
                              int topClients,
                              int hourlyBuckets,
                              int summaryRecentCalls,
                              int detailRecentCalls) {
        this.serverName = serverName;
        this.topClients = topClients;
        this.hourlyBuckets = hourlyBuckets;
        this.summaryRecentCalls = summaryRecentCalls;
        this.detailRecentCalls = detailRecentCalls;
    }

    public AnalyticsSummary summarize(AnalyticsSnapshot snapshot, Instant now) {
        return new AnalyticsSummary(
                serverName,
                snapshot.startTime(),
                UptimeFormatter.format(snapshot.startTime(), now),
                new AnalyticsSummary.Totals(
                        snapshot.totalRequests(),
                        snapshot.totalToolCalls(),
                        snapshot.requestsByClientIp().size()),
                new AnalyticsSummary.Breakdown(
                        snapshot.requestsByMethod(),
                        snapshot.requestsByEndpoint(),
                        byCountDescending(snapshot.toolCallsByTool(), Integer.MAX_VALUE)),
                new AnalyticsSummary.Clients(
                        byCountDescending(snapshot.requestsByClientIp(), topClients),
                        snapshot.requestsByUserAgentPrefix()),
                latestHours(snapshot.requestsByHour(), hourlyBuckets),
                newest(snapshot.recentToolCalls(), summaryRecentCalls));
    }

    public ToolUsageReport toolUsage(AnalyticsSnapshot snapshot) {
        List<ToolUsageReport.ToolCount> tools = byCountDescending(snapshot.toolCallsByTool(), Integer.MAX_VALUE)
                .entrySet().stream()
                .map(e -> new ToolUsageReport.ToolCount(e.getKey(), e.getValue()))
                .toList();
        return new ToolUsageReport(
                snapshot.totalToolCalls(),
                tools,
                newest(snapshot.recentToolCalls(), detailRecentCalls));
    }

    /**
     * Entries by descending count, ties in original order, at most {@code limit}.
     */
    static Map<String, Long> byCountDescending(Map<String, Long> tally, int limit) {
        return tally.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .collect(toOrderedMap());
    }

    /**
     * The {@code count} most recent hour buckets, oldest first. Bucket keys sort chronologically.
     */
    static Map<String, Long> latestHours(Map<String, Long> byHour, int count) {
        int skip = Math.max(0, byHour.size() - count);
        return byHour.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .skip(skip)
                .collect(toOrderedMap());
    }

    private static List<ToolCallRecord> newest(List<ToolCallRecord> newestFirst, int count) {
        return newestFirst.size() <= count ? newestFirst : List.copyOf(newestFirst.subList(0, count));
    }

    private static Collector<Map.Entry<String, Long>, ?, Map<String, Long>> toOrderedMap() {
        return Collectors.collectingAndThen(
                Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new),
                Collections::unmodifiableMap);
    }
}
