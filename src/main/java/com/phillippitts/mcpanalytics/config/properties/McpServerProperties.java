package com.phillippitts.mcpanalytics.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the MCP server as reported by the info and health endpoints.
 * Binds to properties prefixed with "mcp.server".
 *
 * <p>Example application.properties:
 * <pre>
 * mcp.server.name=Codex MCP Server
 * mcp.server.version=1.4.0
 * </pre>
 *
 * @param name        Display name of the server
 * @param version     Server version string
 * @param description One-line description shown on the root endpoint
 */
@ConfigurationProperties(prefix = "mcp.server")
@Validated
public record McpServerProperties(
        @NotBlank(message = "Server name must not be blank")
        String name,

        @NotBlank(message = "Server version must not be blank")
        String version,

        String description
) {

    static final String DEFAULT_NAME = "Codex MCP Server";
    static final String DEFAULT_VERSION = "1.4.0";

    public McpServerProperties {
        name = name == null ? DEFAULT_NAME : name;
        version = version == null ? DEFAULT_VERSION : version;
        description = description == null ? "" : description;
    }

    /**
     * Properties with every value defaulted.
     *
     * @return default server identity
     */
    public static McpServerProperties defaults() {
        return new McpServerProperties(null, null, null);
    }
}
