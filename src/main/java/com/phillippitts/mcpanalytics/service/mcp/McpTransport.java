package com.phillippitts.mcpanalytics.service.mcp;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

/**
 * Protocol handler behind the {@code /mcp} route.
 *
 * <p>The analytics layer only observes traffic on that route; session management and tool
 * execution belong to the implementation registered as a bean.
 */
public interface McpTransport {

    /**
     * Handles one exchange on the protocol endpoint.
     *
     * @param method  GET (server-sent stream), POST (JSON-RPC message) or DELETE (session end)
     * @param headers request headers, including any session id
     * @param body    raw request body; null for GET and DELETE
     * @return the response to send back
     * @throws Exception on any transport failure; the caller answers with a JSON-RPC internal error
     */
    ResponseEntity<String> handle(HttpMethod method, HttpHeaders headers, String body) throws Exception;
}
