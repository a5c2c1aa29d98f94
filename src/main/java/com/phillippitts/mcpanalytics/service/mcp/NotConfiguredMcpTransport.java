package com.phillippitts.mcpanalytics.service.mcp;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Transport used when no protocol implementation is deployed. Answers 503 so clients see
 * the endpoint exists but cannot serve sessions; traffic is still counted.
 */
public class NotConfiguredMcpTransport implements McpTransport {

    private static final Logger LOG = LogManager.getLogger(NotConfiguredMcpTransport.class);

    static final String MESSAGE = "MCP transport not configured";

    @Override
    public ResponseEntity<String> handle(HttpMethod method, HttpHeaders headers, String body) {
        LOG.debug("No MCP transport registered; rejecting {} /mcp", method);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.APPLICATION_JSON)
                .body(JsonRpcErrors.error(JsonRpcErrors.INTERNAL_ERROR, MESSAGE));
    }
}
