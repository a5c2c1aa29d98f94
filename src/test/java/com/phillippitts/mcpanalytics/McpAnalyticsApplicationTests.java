package com.phillippitts.mcpanalytics;

import com.phillippitts.mcpanalytics.domain.AnalyticsSummary;
import com.phillippitts.mcpanalytics.service.analytics.TelemetryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class McpAnalyticsApplicationTests {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void analyticsProperties(DynamicPropertyRegistry registry) {
        registry.add("analytics.data-dir", () -> dataDir.toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TelemetryService telemetry;

    @Test
    void healthEndpointReportsServerIdentity() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.server").value("Codex MCP Server"))
                .andExpect(jsonPath("$.transport").value("streamable-http"));
    }

    @Test
    void rootEndpointListsEndpoints() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.4.0"))
                .andExpect(jsonPath("$.endpoints.mcp").value("/mcp"))
                .andExpect(jsonPath("$.endpoints.analyticsDashboard").value("/analytics/dashboard"));
    }

    @Test
    void dashboardServesHtmlAndIsCounted() throws Exception {
        mockMvc.perform(get("/analytics/dashboard"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andExpect(content().string(containsString("<title>Codex MCP Server - Analytics Dashboard</title>")))
                .andExpect(content().string(not(containsString("{{serverName}}"))));

        assertThat(telemetry.summarize().breakdown().byEndpoint()).containsKey("/analytics/dashboard");
    }

    @Test
    void requestsAreCountedByMatchedRoute() throws Exception {
        mockMvc.perform(get("/health").header("X-Forwarded-For", "198.51.100.23").header("User-Agent", "uptime-check/1.0"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.server").value("Codex MCP Server"))
                .andExpect(jsonPath("$.breakdown.byEndpoint['/health']").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.breakdown.byEndpoint['/analytics']").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.clients.byIp['198.51.100.23']").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.clients.byUserAgent['uptime-check/1.0']").value(greaterThanOrEqualTo(1)));
    }

    @Test
    void unmappedPathsAreNotCounted() throws Exception {
        mockMvc.perform(get("/does-not-exist")).andExpect(status().isNotFound());

        assertThat(telemetry.summarize().breakdown().byEndpoint()).doesNotContainKey("/does-not-exist");
    }

    @Test
    void toolCallsOnProtocolEndpointAreCounted() throws Exception {
        mockMvc.perform(post("/mcp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{\"name\":\"hello\"}}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value(-32603));

        mockMvc.perform(get("/analytics/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tools[?(@.name == 'hello')]").exists())
                .andExpect(jsonPath("$.recentCalls[0].tool").value("hello"));
    }

    @Test
    void negativeImportIsRejected() throws Exception {
        long before = telemetry.summarize().summary().totalRequests();

        mockMvc.perform(post("/analytics/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalRequests\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidImportException"))
                .andExpect(jsonPath("$.message").value("Failed to import analytics"));

        // only the rejected request itself was counted
        assertThat(telemetry.summarize().summary().totalRequests()).isEqualTo(before + 1);
    }

    @Test
    void malformedImportIsRejected() throws Exception {
        mockMvc.perform(post("/analytics/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalRequests\": \"many\"}"))
                .andExpect(status().isBadRequest());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"totalRequests\": -0.5}",
            "{\"totalRequests\": 2.9}",
            "{\"totalToolCalls\": \"7\"}"
    })
    void nonIntegerImportIsRejectedWithoutChangingTotals(String body) throws Exception {
        AnalyticsSummary.Totals before = telemetry.summarize().summary();

        mockMvc.perform(post("/analytics/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));

        AnalyticsSummary.Totals after = telemetry.summarize().summary();
        assertThat(after.totalRequests()).isEqualTo(before.totalRequests() + 1);
        assertThat(after.totalToolCalls()).isEqualTo(before.totalToolCalls());
    }

    @Test
    void importAddsTotalsAndPersists() throws Exception {
        mockMvc.perform(post("/analytics/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalRequests\": 10, \"totalToolCalls\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Analytics imported successfully"))
                .andExpect(jsonPath("$.currentStats.totalRequests").value(greaterThanOrEqualTo(11)))
                .andExpect(jsonPath("$.currentStats.totalToolCalls").value(greaterThanOrEqualTo(2)));

        assertThat(Files.exists(dataDir.resolve("analytics.json"))).isTrue();
    }

    @Test
    void persistenceHealthIsExposedThroughActuator() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.snapshotPersistence.details.file").exists());
    }
}
