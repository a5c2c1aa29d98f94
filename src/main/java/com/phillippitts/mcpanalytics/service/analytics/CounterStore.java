package com.phillippitts.mcpanalytics.service.analytics;

import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;
import com.phillippitts.mcpanalytics.domain.AnalyticsSummary;
import com.phillippitts.mcpanalytics.domain.RequestContext;
import com.phillippitts.mcpanalytics.domain.ToolCallRecord;
import com.phillippitts.mcpanalytics.domain.ToolUsageReport;
import com.phillippitts.mcpanalytics.exception.RecordingException;
import com.phillippitts.mcpanalytics.util.HeaderValues;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory analytics aggregate: cumulative totals, keyed tallies and the recent tool-call feed.
 *
 * <p>Thread-safety: every mutation and every copy runs under this instance's monitor, so
 * concurrent recorders never lose an increment and a copy never sees a half-applied event.
 * Summaries are derived from a copy outside the monitor.
 *
 * <p>No I/O happens here; persistence works on {@link #snapshot()} and {@link #restore}.
 */
public class CounterStore {

    static final DateTimeFormatter HOUR_BUCKET =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC);

    private final SnapshotSummarizer summarizer;
    private final int userAgentMaxLength;
    private final RecentToolCalls recentToolCalls;

    private Instant startTime;
    private long totalRequests;
    private long totalToolCalls;
    private final Map<String, Long> requestsByMethod = new LinkedHashMap<>();
    private final Map<String, Long> requestsByEndpoint = new LinkedHashMap<>();
    private final Map<String, Long> toolCallsByTool = new LinkedHashMap<>();
    private final Map<String, Long> requestsByClientIp = new LinkedHashMap<>();
    private final Map<String, Long> requestsByUserAgentPrefix = new LinkedHashMap<>();
    private final Map<String, Long> requestsByHour = new LinkedHashMap<>();

    /**
     * @param summarizer          derives read-only views from snapshots
     * @param recentCallsCapacity maximum size of the recent tool-call feed
     * @param userAgentMaxLength  user agents are truncated to this many characters
     * @param startTime           server start time until a recovered snapshot replaces it
     */
    public CounterStore(SnapshotSummarizer summarizer,
                        int recentCallsCapacity,
                        int userAgentMaxLength,
                        Instant startTime) {
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.userAgentMaxLength = userAgentMaxLength;
        this.recentToolCalls = new RecentToolCalls(recentCallsCapacity);
        this.startTime = Objects.requireNonNull(startTime, "startTime");
    }

    /**
     * Counts one inbound request against the totals, the method, endpoint, client,
     * user-agent and hour tallies.
     *
     * @throws RecordingException if method or endpoint is missing
     */
    public synchronized void recordRequest(String method,
                                           String endpoint,
                                           String clientIdentity,
                                           String userAgent,
                                           Instant now) {
        requireText(method, "request", "HTTP method is required");
        requireText(endpoint, "request", "Endpoint is required");
        String hour = HOUR_BUCKET.format(now);

        totalRequests++;
        increment(requestsByMethod, method);
        increment(requestsByEndpoint, endpoint);
        increment(requestsByClientIp, clientKey(clientIdentity));
        increment(requestsByUserAgentPrefix, userAgentKey(userAgent));
        increment(requestsByHour, hour);
    }

    /**
     * Counts one tool invocation and prepends it to the recent feed.
     *
     * @throws RecordingException if the tool name is missing
     */
    public synchronized void recordToolCall(String toolName,
                                            String clientIdentity,
                                            String userAgent,
                                            Instant now) {
        requireText(toolName, "tool-call", "Tool name is required");
        ToolCallRecord record = new ToolCallRecord(
                toolName, Objects.requireNonNull(now, "now"), clientKey(clientIdentity), userAgentKey(userAgent));

        totalToolCalls++;
        increment(toolCallsByTool, toolName);
        recentToolCalls.add(record);
    }

    /**
     * Adds externally supplied counts to the cumulative totals. Keyed tallies are untouched.
     * Either both totals change or neither does.
     *
     * @throws IllegalArgumentException if either delta is negative
     * @throws ArithmeticException if a total would overflow
     */
    public synchronized void applyDelta(long totalRequestsDelta, long totalToolCallsDelta) {
        if (totalRequestsDelta < 0 || totalToolCallsDelta < 0) {
            throw new IllegalArgumentException("Deltas must be non-negative, got: "
                    + totalRequestsDelta + ", " + totalToolCallsDelta);
        }
        long requests = Math.addExact(totalRequests, totalRequestsDelta);
        long toolCalls = Math.addExact(totalToolCalls, totalToolCallsDelta);
        totalRequests = requests;
        totalToolCalls = toolCalls;
    }

    public synchronized long totalRequests() {
        return totalRequests;
    }

    public synchronized long totalToolCalls() {
        return totalToolCalls;
    }

    /**
     * Consistent immutable copy of the whole aggregate.
     */
    public synchronized AnalyticsSnapshot snapshot() {
        return new AnalyticsSnapshot(
                startTime,
                totalRequests,
                totalToolCalls,
                requestsByMethod,
                requestsByEndpoint,
                toolCallsByTool,
                requestsByClientIp,
                requestsByUserAgentPrefix,
                requestsByHour,
                recentToolCalls.toList());
    }

    /**
     * Replaces the whole aggregate, start time included, with a recovered snapshot.
     */
    public synchronized void restore(AnalyticsSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        startTime = snapshot.startTime();
        totalRequests = snapshot.totalRequests();
        totalToolCalls = snapshot.totalToolCalls();
        replace(requestsByMethod, snapshot.requestsByMethod());
        replace(requestsByEndpoint, snapshot.requestsByEndpoint());
        replace(toolCallsByTool, snapshot.toolCallsByTool());
        replace(requestsByClientIp, snapshot.requestsByClientIp());
        replace(requestsByUserAgentPrefix, snapshot.requestsByUserAgentPrefix());
        replace(requestsByHour, snapshot.requestsByHour());
        recentToolCalls.replaceWith(snapshot.recentToolCalls());
    }

    /**
     * Summary as of {@code now}. Does not mutate state.
     */
    public AnalyticsSummary summarize(Instant now) {
        return summarizer.summarize(snapshot(), now);
    }

    /**
     * Tool usage detail view. Does not mutate state.
     */
    public ToolUsageReport toolUsage() {
        return summarizer.toolUsage(snapshot());
    }

    private String clientKey(String clientIdentity) {
        return HeaderValues.orDefault(clientIdentity, RequestContext.UNKNOWN);
    }

    private String userAgentKey(String userAgent) {
        return HeaderValues.truncate(HeaderValues.orDefault(userAgent, RequestContext.UNKNOWN), userAgentMaxLength);
    }

    private static void increment(Map<String, Long> tally, String key) {
        tally.merge(key, 1L, Long::sum);
    }

    private static void replace(Map<String, Long> target, Map<String, Long> source) {
        target.clear();
        target.putAll(source);
    }

    private static void requireText(String value, String eventKind, String message) {
        if (value == null || value.isBlank()) {
            throw new RecordingException(eventKind, message);
        }
    }
}
