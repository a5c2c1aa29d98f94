/**
 * Request tracking for the analytics engine.
 *
 * @see com.phillippitts.mcpanalytics.presentation.interceptor.RequestTrackingInterceptor
 */
package com.phillippitts.mcpanalytics.presentation.interceptor;
