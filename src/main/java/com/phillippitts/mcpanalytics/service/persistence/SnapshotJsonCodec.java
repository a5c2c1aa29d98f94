package com.phillippitts.mcpanalytics.service.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;
import com.phillippitts.mcpanalytics.domain.RequestContext;
import com.phillippitts.mcpanalytics.domain.ToolCallRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps {@link AnalyticsSnapshot} to and from the JSON document stored on disk.
 *
 * <p>Decoding is field by field. A missing field takes its default silently (older files
 * simply lack newer fields); a present but malformed field takes its default with a warning.
 * Within tallies and the recent feed, malformed entries are dropped one by one so a single bad
 * entry never costs the rest of the field.
 *
 * <p>Document layout:
 * <pre>
 * {
 *   "serverStartTime" : "2026-10-01T08:00:00Z",
 *   "totalRequests" : 1520,
 *   "totalToolCalls" : 310,
 *   "requestsByMethod" : { "POST" : 1200, "GET" : 320 },
 *   "requestsByEndpoint" : { "/mcp" : 1200, "/health" : 320 },
 *   "toolCalls" : { "codex" : 300, "ping" : 10 },
 *   "recentToolCalls" : [ { "tool" : "codex", "timestamp" : "...", "clientIp" : "...", "userAgent" : "..." } ],
 *   "clientsByIp" : { "203.0.113.7" : 900 },
 *   "clientsByUserAgent" : { "node" : 1200 },
 *   "hourlyRequests" : { "2026-10-17T09" : 42 }
 * }
 * </pre>
 */
final class SnapshotJsonCodec {

    private static final Logger LOG = LogManager.getLogger(SnapshotJsonCodec.class);

    static final String START_TIME = "serverStartTime";
    static final String TOTAL_REQUESTS = "totalRequests";
    static final String TOTAL_TOOL_CALLS = "totalToolCalls";
    static final String BY_METHOD = "requestsByMethod";
    static final String BY_ENDPOINT = "requestsByEndpoint";
    static final String BY_TOOL = "toolCalls";
    static final String RECENT_TOOL_CALLS = "recentToolCalls";
    static final String BY_CLIENT_IP = "clientsByIp";
    static final String BY_USER_AGENT = "clientsByUserAgent";
    static final String BY_HOUR = "hourlyRequests";

    private final int recentCallsCapacity;

    SnapshotJsonCodec(int recentCallsCapacity) {
        this.recentCallsCapacity = recentCallsCapacity;
    }

    ObjectNode encode(AnalyticsSnapshot snapshot) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(START_TIME, snapshot.startTime().toString());
        root.put(TOTAL_REQUESTS, snapshot.totalRequests());
        root.put(TOTAL_TOOL_CALLS, snapshot.totalToolCalls());
        putTally(root, BY_METHOD, snapshot.requestsByMethod());
        putTally(root, BY_ENDPOINT, snapshot.requestsByEndpoint());
        putTally(root, BY_TOOL, snapshot.toolCallsByTool());

        ArrayNode recent = root.putArray(RECENT_TOOL_CALLS);
        for (ToolCallRecord call : snapshot.recentToolCalls()) {
            ObjectNode entry = recent.addObject();
            entry.put("tool", call.tool());
            entry.put("timestamp", call.timestamp().toString());
            entry.put("clientIp", call.clientIp());
            entry.put("userAgent", call.userAgent());
        }

        putTally(root, BY_CLIENT_IP, snapshot.requestsByClientIp());
        putTally(root, BY_USER_AGENT, snapshot.requestsByUserAgentPrefix());
        putTally(root, BY_HOUR, snapshot.requestsByHour());
        return root;
    }

    /**
     * Decodes a snapshot document.
     *
     * @param root              top-level JSON object
     * @param fallbackStartTime start time used when {@code serverStartTime} is missing or malformed
     * @return decoded snapshot; never fails on field-level problems
     */
    AnalyticsSnapshot decode(JsonNode root, Instant fallbackStartTime) {
        return new AnalyticsSnapshot(
                readStartTime(root.get(START_TIME), fallbackStartTime),
                readCount(root.get(TOTAL_REQUESTS), TOTAL_REQUESTS),
                readCount(root.get(TOTAL_TOOL_CALLS), TOTAL_TOOL_CALLS),
                readTally(root.get(BY_METHOD), BY_METHOD),
                readTally(root.get(BY_ENDPOINT), BY_ENDPOINT),
                readTally(root.get(BY_TOOL), BY_TOOL),
                readTally(root.get(BY_CLIENT_IP), BY_CLIENT_IP),
                readTally(root.get(BY_USER_AGENT), BY_USER_AGENT),
                readTally(root.get(BY_HOUR), BY_HOUR),
                readRecent(root.get(RECENT_TOOL_CALLS)));
    }

    private static void putTally(ObjectNode root, String field, Map<String, Long> tally) {
        ObjectNode node = root.putObject(field);
        tally.forEach((key, count) -> node.put(key, count.longValue()));
    }

    private static Instant readStartTime(JsonNode node, Instant fallback) {
        if (isAbsent(node)) {
            return fallback;
        }
        Instant parsed = parseInstant(node);
        if (parsed == null) {
            LOG.warn("Malformed {} in analytics snapshot; using {}", START_TIME, fallback);
            return fallback;
        }
        return parsed;
    }

    private static long readCount(JsonNode node, String field) {
        if (isAbsent(node)) {
            return 0L;
        }
        if (!isCount(node)) {
            LOG.warn("Malformed {} in analytics snapshot; defaulting to 0", field);
            return 0L;
        }
        return node.longValue();
    }

    private static Map<String, Long> readTally(JsonNode node, String field) {
        Map<String, Long> tally = new LinkedHashMap<>();
        if (isAbsent(node)) {
            return tally;
        }
        if (!node.isObject()) {
            LOG.warn("Malformed {} in analytics snapshot; defaulting to empty", field);
            return tally;
        }
        int dropped = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (isCount(entry.getValue())) {
                tally.put(entry.getKey(), entry.getValue().longValue());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} malformed entries from {} in analytics snapshot", dropped, field);
        }
        return tally;
    }

    private List<ToolCallRecord> readRecent(JsonNode node) {
        List<ToolCallRecord> recent = new ArrayList<>();
        if (isAbsent(node)) {
            return recent;
        }
        if (!node.isArray()) {
            LOG.warn("Malformed {} in analytics snapshot; defaulting to empty", RECENT_TOOL_CALLS);
            return recent;
        }
        int dropped = 0;
        for (JsonNode entry : node) {
            if (recent.size() == recentCallsCapacity) {
                break;
            }
            ToolCallRecord call = readToolCall(entry);
            if (call == null) {
                dropped++;
            } else {
                recent.add(call);
            }
        }
        if (dropped > 0) {
            LOG.warn("Dropped {} malformed entries from {} in analytics snapshot", dropped, RECENT_TOOL_CALLS);
        }
        return recent;
    }

    private static ToolCallRecord readToolCall(JsonNode entry) {
        if (!entry.isObject()) {
            return null;
        }
        JsonNode tool = entry.get("tool");
        if (tool == null || !tool.isTextual() || tool.textValue().isBlank()) {
            return null;
        }
        Instant timestamp = parseInstant(entry.get("timestamp"));
        if (timestamp == null) {
            return null;
        }
        return new ToolCallRecord(
                tool.textValue(),
                timestamp,
                textOrUnknown(entry.get("clientIp")),
                textOrUnknown(entry.get("userAgent")));
    }

    private static Instant parseInstant(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.textValue());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String textOrUnknown(JsonNode node) {
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            return RequestContext.UNKNOWN;
        }
        return node.textValue();
    }

    private static boolean isCount(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToLong() && node.longValue() >= 0;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull();
    }
}
