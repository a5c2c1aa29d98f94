/**
 * Seam to the MCP protocol handler and the JSON-RPC inspection used to count tool calls.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.mcpanalytics.service.mcp.McpTransport} - Pluggable protocol handler</li>
 *   <li>{@link com.phillippitts.mcpanalytics.service.mcp.JsonRpcToolCallExtractor} - Tool names from
 *       {@code tools/call} messages, single or batched</li>
 * </ul>
 */
package com.phillippitts.mcpanalytics.service.mcp;
