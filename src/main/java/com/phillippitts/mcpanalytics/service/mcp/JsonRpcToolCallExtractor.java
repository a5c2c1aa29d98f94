package com.phillippitts.mcpanalytics.service.mcp;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls tool names out of JSON-RPC {@code tools/call} messages.
 * Safe against malformed input: anything unparseable yields no tool calls.
 */
public final class JsonRpcToolCallExtractor {

    static final String TOOLS_CALL = "tools/call";

    private JsonRpcToolCallExtractor() {}

    /**
     * Tool names invoked by a single message or a batch, in message order.
     *
     * @param body raw JSON-RPC request body, may be null
     * @return tool names, empty if the body carries no tool call
     */
    public static List<String> toolNames(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        Object parsed;
        try {
            parsed = new JSONTokener(body).nextValue();
        } catch (JSONException e) {
            // not JSON; the transport reports the parse error to the client
            return List.of();
        }
        List<String> names = new ArrayList<>();
        if (parsed instanceof JSONObject message) {
            addToolName(message, names);
        } else if (parsed instanceof JSONArray batch) {
            for (int i = 0; i < batch.length(); i++) {
                JSONObject message = batch.optJSONObject(i);
                if (message != null) {
                    addToolName(message, names);
                }
            }
        }
        return List.copyOf(names);
    }

    private static void addToolName(JSONObject message, List<String> names) {
        if (!TOOLS_CALL.equals(message.optString("method", null))) {
            return;
        }
        JSONObject params = message.optJSONObject("params");
        if (params == null) {
            return;
        }
        Object name = params.opt("name");
        if (name instanceof String tool && !tool.isBlank()) {
            names.add(tool);
        }
    }
}
