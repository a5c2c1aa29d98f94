/**
 * Domain model of the analytics engine.
 *
 * <p>Immutable records only: the live, mutable aggregate is private to
 * {@code service.analytics.CounterStore} and leaves it as an {@link
 * com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot} copy.
 *
 * @since 1.0
 */
package com.phillippitts.mcpanalytics.domain;
