package com.phillippitts.mcpanalytics.presentation.interceptor;

import com.phillippitts.mcpanalytics.domain.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/**
 * Builds {@link RequestContext} values from servlet requests.
 */
public final class HttpRequestContexts {

    private HttpRequestContexts() {}

    /**
     * @param request  the servlet request
     * @param endpoint logical endpoint the request is counted under
     * @return context with the resolved client identity and the raw user agent
     */
    public static RequestContext from(HttpServletRequest request, String endpoint) {
        return new RequestContext(
                request.getMethod(),
                endpoint,
                RequestContext.resolveClientIdentity(
                        request.getHeader(RequestContext.FORWARDED_FOR_HEADER),
                        request.getRemoteAddr()),
                request.getHeader(HttpHeaders.USER_AGENT));
    }
}
