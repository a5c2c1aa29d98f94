package com.phillippitts.mcpanalytics.service.mcp;

import org.json.JSONObject;

/**
 * JSON-RPC 2.0 error envelopes returned by the {@code /mcp} route.
 */
public final class JsonRpcErrors {

    /** JSON-RPC "Internal error" code. */
    public static final int INTERNAL_ERROR = -32603;

    private JsonRpcErrors() {}

    /**
     * Builds an error response with a null id.
     *
     * @param code    JSON-RPC error code
     * @param message human-readable message
     * @return serialized JSON-RPC error object
     */
    public static String error(int code, String message) {
        JSONObject error = new JSONObject()
                .put("code", code)
                .put("message", message);
        return new JSONObject()
                .put("jsonrpc", "2.0")
                .put("error", error)
                .put("id", JSONObject.NULL)
                .toString();
    }
}
