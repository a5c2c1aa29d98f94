package com.phillippitts.mcpanalytics.presentation.controller;

import com.phillippitts.mcpanalytics.config.properties.McpServerProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server identity and liveness endpoints.
 */
@RestController
class ServerInfoController {

    static final String TRANSPORT = "streamable-http";

    private final McpServerProperties server;
    private final Clock clock;

    ServerInfoController(McpServerProperties server, Clock clock) {
        this.server = server;
        this.clock = clock;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("mcp", "/mcp");
        endpoints.put("health", "/health");
        endpoints.put("analytics", "/analytics");
        endpoints.put("analyticsTools", "/analytics/tools");
        endpoints.put("analyticsDashboard", "/analytics/dashboard");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", server.name());
        body.put("version", server.version());
        body.put("description", server.description());
        body.put("transport", TRANSPORT);
        body.put("endpoints", endpoints);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("server", server.name());
        body.put("version", server.version());
        body.put("transport", TRANSPORT);
        body.put("timestamp", clock.instant().toString());
        return ResponseEntity.ok(body);
    }
}
