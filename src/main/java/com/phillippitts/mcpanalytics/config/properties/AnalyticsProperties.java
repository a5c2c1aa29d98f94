package com.phillippitts.mcpanalytics.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration properties for the analytics engine.
 *
 * <p>Example application.properties:
 * <pre>
 * analytics.data-dir=/var/lib/mcp/data
 * analytics.save-interval=60s
 * analytics.recent-calls-capacity=100
 * </pre>
 *
 * <p>Usually only the data directory changes between deployments.
 */
@ConfigurationProperties(prefix = "analytics")
@Validated
public class AnalyticsProperties {

    /** Directory holding the snapshot file. Created on first save if absent. */
    @NotBlank(message = "Analytics data directory must not be blank")
    private String dataDir = "./data";

    /** Snapshot file name inside {@link #dataDir}. */
    @NotBlank(message = "Analytics file name must not be blank")
    private String fileName = "analytics.json";

    /** Period between background snapshot saves. */
    @NotNull
    private Duration saveInterval = Duration.ofSeconds(60);

    /** Maximum number of tool-call records retained in the recent ring. */
    @Positive(message = "Recent calls capacity must be positive")
    private int recentCallsCapacity = 100;

    /** User-agent strings are truncated to this many characters before tallying. */
    @Positive(message = "User agent max length must be positive")
    private int userAgentMaxLength = 50;

    /** Number of clients listed in the summary, by descending request count. */
    @Positive(message = "Top clients must be positive")
    private int topClients = 20;

    /** Number of hour buckets returned in the summary. */
    @Positive(message = "Hourly buckets must be positive")
    private int hourlyBuckets = 24;

    /** Recent tool calls included in the general summary. */
    @Positive(message = "Summary recent calls must be positive")
    private int summaryRecentCalls = 20;

    /** Recent tool calls included in the tool detail view. */
    @Positive(message = "Detail recent calls must be positive")
    private int detailRecentCalls = 50;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public Duration getSaveInterval() {
        return saveInterval;
    }

    public void setSaveInterval(Duration saveInterval) {
        this.saveInterval = saveInterval;
    }

    public int getRecentCallsCapacity() {
        return recentCallsCapacity;
    }

    public void setRecentCallsCapacity(int recentCallsCapacity) {
        this.recentCallsCapacity = recentCallsCapacity;
    }

    public int getUserAgentMaxLength() {
        return userAgentMaxLength;
    }

    public void setUserAgentMaxLength(int userAgentMaxLength) {
        this.userAgentMaxLength = userAgentMaxLength;
    }

    public int getTopClients() {
        return topClients;
    }

    public void setTopClients(int topClients) {
        this.topClients = topClients;
    }

    public int getHourlyBuckets() {
        return hourlyBuckets;
    }

    public void setHourlyBuckets(int hourlyBuckets) {
        this.hourlyBuckets = hourlyBuckets;
    }

    public int getSummaryRecentCalls() {
        return summaryRecentCalls;
    }

    public void setSummaryRecentCalls(int summaryRecentCalls) {
        this.summaryRecentCalls = summaryRecentCalls;
    }

    public int getDetailRecentCalls() {
        return detailRecentCalls;
    }

    public void setDetailRecentCalls(int detailRecentCalls) {
        this.detailRecentCalls = detailRecentCalls;
    }

    /**
     * Resolves the snapshot file location from {@link #dataDir} and {@link #fileName}.
     *
     * @return path of the snapshot file (may not exist yet)
     */
    public Path snapshotFile() {
        return Paths.get(dataDir).resolve(fileName);
    }
}
