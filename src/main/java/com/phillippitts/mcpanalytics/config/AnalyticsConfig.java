package com.phillippitts.mcpanalytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.mcpanalytics.config.properties.AnalyticsProperties;
import com.phillippitts.mcpanalytics.config.properties.McpServerProperties;
import com.phillippitts.mcpanalytics.service.analytics.SnapshotSummarizer;
import com.phillippitts.mcpanalytics.service.mcp.McpTransport;
import com.phillippitts.mcpanalytics.service.mcp.NotConfiguredMcpTransport;
import com.phillippitts.mcpanalytics.service.metrics.AnalyticsMetrics;
import com.phillippitts.mcpanalytics.service.persistence.JsonFileSnapshotStore;
import com.phillippitts.mcpanalytics.service.persistence.SnapshotPersistence;
import com.phillippitts.mcpanalytics.service.persistence.SnapshotStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the analytics engine's collaborators from {@link AnalyticsProperties}.
 * Uses constructor injection to share the properties across bean methods.
 */
@Configuration
public class AnalyticsConfig {

    private final AnalyticsProperties analyticsProperties;
    private final McpServerProperties serverProperties;

    public AnalyticsConfig(AnalyticsProperties analyticsProperties, McpServerProperties serverProperties) {
        this.analyticsProperties = analyticsProperties;
        this.serverProperties = serverProperties;
    }

    /**
     * Read-side views with the configured list sizes.
     */
    @Bean
    public SnapshotSummarizer snapshotSummarizer() {
        return new SnapshotSummarizer(
                serverProperties.name(),
                analyticsProperties.getTopClients(),
                analyticsProperties.getHourlyBuckets(),
                analyticsProperties.getSummaryRecentCalls(),
                analyticsProperties.getDetailRecentCalls());
    }

    /**
     * JSON file under {@code analytics.data-dir}.
     */
    @Bean
    @ConditionalOnMissingBean(SnapshotStore.class)
    public SnapshotStore snapshotStore(ObjectMapper objectMapper) {
        return new JsonFileSnapshotStore(
                analyticsProperties.snapshotFile(),
                objectMapper,
                analyticsProperties.getRecentCallsCapacity());
    }

    @Bean
    public SnapshotPersistence snapshotPersistence(SnapshotStore snapshotStore,
                                                   AnalyticsMetrics metrics,
                                                   Clock analyticsClock) {
        return new SnapshotPersistence(snapshotStore, metrics, analyticsClock);
    }

    /**
     * Placeholder protocol handler, replaced by any {@link McpTransport} bean the deployment provides.
     */
    @Bean
    @ConditionalOnMissingBean(McpTransport.class)
    public McpTransport mcpTransport() {
        return new NotConfiguredMcpTransport();
    }
}
