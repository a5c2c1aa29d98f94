package com.phillippitts.mcpanalytics.domain;

/**
 * What the HTTP layer knows about one inbound request, as consumed by the analytics engine.
 *
 * <p>Values are raw; the counter store applies the "unknown" sentinel and user-agent truncation.
 *
 * @param method         HTTP method token (e.g. GET)
 * @param endpoint       Logical endpoint name, normally the matched route pattern
 * @param clientIdentity Resolved client identity, may be null
 * @param userAgent      Raw User-Agent header, may be null
 */
public record RequestContext(
        String method,
        String endpoint,
        String clientIdentity,
        String userAgent
) {

    /** Forwarded-address header consulted before the peer address. */
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    /** Sentinel used when a client identity or user agent is unavailable. */
    public static final String UNKNOWN = "unknown";

    /**
     * Resolves the client identity: first entry of a forwarded-for list, else the peer address,
     * else {@value #UNKNOWN}.
     *
     * @param forwardedFor  value of the X-Forwarded-For header, may be null
     * @param remoteAddress transport-level peer address, may be null
     * @return non-blank client identity
     */
    public static String resolveClientIdentity(String forwardedFor, String remoteAddress) {
        if (forwardedFor != null) {
            int comma = forwardedFor.indexOf(',');
            String first = (comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (remoteAddress != null && !remoteAddress.isBlank()) {
            return remoteAddress;
        }
        return UNKNOWN;
    }
}
