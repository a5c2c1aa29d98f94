package com.phillippitts.mcpanalytics.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the recent tool-call feed.
 *
 * @param tool      Name of the invoked tool
 * @param timestamp When the call was recorded
 * @param clientIp  Resolved client identity ("unknown" when none was available)
 * @param userAgent User agent truncated to the configured prefix length ("unknown" when absent)
 */
public record ToolCallRecord(
        String tool,
        Instant timestamp,
        String clientIp,
        String userAgent
) {

    public ToolCallRecord {
        Objects.requireNonNull(tool, "Tool name must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(clientIp, "Client identity must not be null");
        Objects.requireNonNull(userAgent, "User agent must not be null");
    }
}
