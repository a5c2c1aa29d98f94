package com.phillippitts.mcpanalytics.presentation.interceptor;

import com.phillippitts.mcpanalytics.domain.RequestContext;
import com.phillippitts.mcpanalytics.service.analytics.TelemetryService;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Counts every request dispatched to a controller method before the controller runs,
 * so an analytics view includes the request that asked for it.
 *
 * <p>The endpoint key is the matched route pattern. Requests for unmapped paths and error
 * re-dispatches are not counted.
 */
@Component
public class RequestTrackingInterceptor implements HandlerInterceptor {

    /** Request attribute holding the {@link RequestContext} that was recorded. */
    public static final String CONTEXT_ATTRIBUTE = RequestTrackingInterceptor.class.getName() + ".context";

    private final TelemetryService telemetry;

    public RequestTrackingInterceptor(TelemetryService telemetry) {
        this.telemetry = telemetry;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (request.getDispatcherType() != DispatcherType.REQUEST || !(handler instanceof HandlerMethod)) {
            return true;
        }
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        String endpoint = pattern != null ? pattern.toString() : request.getRequestURI();
        RequestContext context = HttpRequestContexts.from(request, endpoint);
        request.setAttribute(CONTEXT_ATTRIBUTE, context);
        telemetry.recordRequest(context);
        return true;
    }
}
