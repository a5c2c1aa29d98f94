package com.phillippitts.mcpanalytics.presentation.controller;

import com.phillippitts.mcpanalytics.domain.RequestContext;
import com.phillippitts.mcpanalytics.presentation.interceptor.HttpRequestContexts;
import com.phillippitts.mcpanalytics.presentation.interceptor.RequestTrackingInterceptor;
import com.phillippitts.mcpanalytics.service.analytics.TelemetryService;
import com.phillippitts.mcpanalytics.service.mcp.JsonRpcErrors;
import com.phillippitts.mcpanalytics.service.mcp.JsonRpcToolCallExtractor;
import com.phillippitts.mcpanalytics.service.mcp.McpTransport;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Protocol endpoint. Counts tool invocations found in JSON-RPC requests, then hands the
 * exchange to the configured {@link McpTransport}.
 */
@RestController
class McpController {

    private static final Logger LOG = LogManager.getLogger(McpController.class);

    static final String PATH = "/mcp";
    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final TelemetryService telemetry;
    private final McpTransport transport;

    McpController(TelemetryService telemetry, McpTransport transport) {
        this.telemetry = telemetry;
        this.transport = transport;
    }

    @PostMapping(PATH)
    ResponseEntity<String> post(@RequestBody(required = false) String body,
                                @RequestHeader HttpHeaders headers,
                                HttpServletRequest request) {
        for (String tool : JsonRpcToolCallExtractor.toolNames(body)) {
            telemetry.recordToolCall(tool, contextOf(request));
        }
        return dispatch(HttpMethod.POST, headers, body);
    }

    @GetMapping(PATH)
    ResponseEntity<String> stream(@RequestHeader HttpHeaders headers) {
        return dispatch(HttpMethod.GET, headers, null);
    }

    @DeleteMapping(PATH)
    ResponseEntity<String> endSession(@RequestHeader HttpHeaders headers) {
        return dispatch(HttpMethod.DELETE, headers, null);
    }

    private ResponseEntity<String> dispatch(HttpMethod method, HttpHeaders headers, String body) {
        try {
            return transport.handle(method, headers, body);
        } catch (Exception e) {
            LOG.error("MCP transport failed handling {} {}", method, PATH, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(JsonRpcErrors.error(JsonRpcErrors.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE));
        }
    }

    private static RequestContext contextOf(HttpServletRequest request) {
        Object tracked = request.getAttribute(RequestTrackingInterceptor.CONTEXT_ATTRIBUTE);
        if (tracked instanceof RequestContext context) {
            return context;
        }
        return HttpRequestContexts.from(request, PATH);
    }
}
