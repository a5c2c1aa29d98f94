package com.phillippitts.mcpanalytics.presentation.controller;

import com.phillippitts.mcpanalytics.config.properties.McpServerProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Browser dashboard over {@code GET /analytics}.
 *
 * <p>The page is static apart from the server name; its script polls the summary endpoint
 * relative to its own path, so it keeps working behind a path-prefixing proxy.
 */
@RestController
class DashboardController {

    static final String PAGE = "dashboard/analytics-dashboard.html";
    static final String SERVER_NAME_PLACEHOLDER = "{{serverName}}";

    private final String html;

    DashboardController(McpServerProperties server) {
        this.html = loadPage().replace(SERVER_NAME_PLACEHOLDER, HtmlUtils.htmlEscape(server.name()));
    }

    @GetMapping(value = "/analytics/dashboard", produces = MediaType.TEXT_HTML_VALUE)
    ResponseEntity<String> dashboard() {
        return ResponseEntity.ok(html);
    }

    private static String loadPage() {
        try {
            return new ClassPathResource(PAGE).getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Dashboard page not found on classpath: " + PAGE, e);
        }
    }
}
