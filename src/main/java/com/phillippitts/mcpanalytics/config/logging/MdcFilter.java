package com.phillippitts.mcpanalytics.config.logging;

import com.phillippitts.mcpanalytics.domain.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tags every log line written while serving a request with the request and the client it came from.
 *
 * <p>The client identity is resolved the same way the analytics tallies resolve it, so a log line
 * can be matched to the client counted under {@code /analytics}. The request id is echoed back in
 * the {@value #REQUEST_ID_HEADER} response header.
 *
 * <p>Only the keys listed in {@link #KEYS} are removed afterwards; anything an outer component
 * put into the {@link ThreadContext} is left alone.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    static final String REQUEST_ID = "requestId";
    static final String CLIENT_IP = "clientIp";
    static final String METHOD = "method";
    static final String URI = "uri";

    /** MDC keys owned by this filter, in the order the console pattern prints them. */
    static final List<String> KEYS = List.of(REQUEST_ID, CLIENT_IP, METHOD, URI);

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        Map<String, String> context = describe(request);
        response.setHeader(REQUEST_ID_HEADER, context.get(REQUEST_ID));
        ThreadContext.putAll(context);
        try {
            chain.doFilter(request, response);
        } finally {
            ThreadContext.removeAll(KEYS);
        }
    }

    static Map<String, String> describe(HttpServletRequest request) {
        String supplied = request.getHeader(REQUEST_ID_HEADER);
        Map<String, String> context = new LinkedHashMap<>();
        context.put(REQUEST_ID, StringUtils.hasText(supplied) ? supplied.trim() : UUID.randomUUID().toString());
        context.put(CLIENT_IP, RequestContext.resolveClientIdentity(
                request.getHeader(RequestContext.FORWARDED_FOR_HEADER), request.getRemoteAddr()));
        context.put(METHOD, request.getMethod());
        context.put(URI, request.getRequestURI());
        return context;
    }
}
