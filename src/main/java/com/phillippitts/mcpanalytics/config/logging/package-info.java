/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Structured logging uses Log4j2 with MDC so that analytics log lines written while
 * serving a request carry the request and client they belong to.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.mcpanalytics.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId}, {@code clientIp}, {@code method} and {@code uri} into MDC</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format unless supplied)</li>
 *   <li>{@code clientIp} - Resolved client identity, same value the analytics tallies use</li>
 *   <li>{@code method}, {@code uri} - HTTP method and raw request URI</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [http-nio-8080-exec-1] [requestId] [clientIp] [GET /analytics] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.mcpanalytics.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.mcpanalytics.config.logging;
