package com.todochat.pipeline;

/**
 * Derives the client identity (used for rate limiting and logs) of a request.
 * <p>
 * The first entry of {@code X-Forwarded-For} wins, then the direct peer address, then
 * {@value #UNKNOWN}. The forwarded header is trusted as-is: the service is expected to sit behind
 * a proxy that overwrites it. Deployed without such a proxy, clients can pick their own bucket.
 */
public final class ClientIdentity {

    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String UNKNOWN = "unknown";

    private ClientIdentity() {
    }

    public static String resolve(HttpRequest request) {
        String forwarded = request.header(FORWARDED_FOR).orElse(null);
        if (forwarded != null) {
            int comma = forwarded.indexOf(',');
            String first = (comma >= 0 ? forwarded.substring(0, comma) : forwarded).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remote = request.remoteAddress();
        if (remote != null && !remote.isBlank()) {
            return remote;
        }
        return UNKNOWN;
    }
}
