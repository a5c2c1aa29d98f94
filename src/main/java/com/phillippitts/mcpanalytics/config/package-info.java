/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.mcpanalytics.config.SchedulingConfig} - Scheduler for periodic
 *       snapshot flushes and the shared UTC clock</li>
 *   <li>{@link com.phillippitts.mcpanalytics.config.WebMvcConfig} - Registers request tracking
 *       on controller routes</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties} bound from
 *       {@code application.properties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.mcpanalytics.config;
