package com.todochat.pipeline.headers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fixed set of hardening and CORS headers stamped on every response, plus the headers to
 * strip. Only the allowed CORS origin is configurable.
 */
public final class SecurityHeaderPolicy {

    public static final String DEFAULT_ALLOWED_ORIGIN = "*";

    /** Content-Security-Policy directives, in emission order. */
    public static final List<String> CSP_DIRECTIVES = List.of(
            "default-src 'self'",
            "script-src 'self' 'unsafe-inline' 'unsafe-eval'",
            "style-src 'self' 'unsafe-inline'",
            "img-src 'self' data: https:",
            "font-src 'self' data:",
            "connect-src 'self'",
            "frame-ancestors 'none'",
            "base-uri 'self'",
            "form-action 'self'"
    );

    private static final Set<String> REMOVED_HEADERS = Set.of("Server");

    private final Map<String, String> headers;

    private SecurityHeaderPolicy(String allowedOrigin) {
        if (allowedOrigin == null || allowedOrigin.isBlank()) {
            throw new IllegalArgumentException("allowedOrigin must not be null or blank");
        }
        Map<String, String> values = new LinkedHashMap<>();
        values.put("Access-Control-Allow-Origin", allowedOrigin);
        values.put("Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, PATCH, OPTIONS");
        values.put("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Correlation-ID");
        values.put("Access-Control-Expose-Headers", "X-Correlation-ID, X-RateLimit-Limit, X-RateLimit-Remaining");
        values.put("Access-Control-Max-Age", "3600");
        values.put("X-Content-Type-Options", "nosniff");
        values.put("X-Frame-Options", "DENY");
        values.put("X-XSS-Protection", "1; mode=block");
        values.put("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
        values.put("Referrer-Policy", "strict-origin-when-cross-origin");
        values.put("Content-Security-Policy", String.join("; ", CSP_DIRECTIVES));
        this.headers = Collections.unmodifiableMap(values);
    }

    /** Policy allowing any CORS origin. */
    public static SecurityHeaderPolicy defaults() {
        return new SecurityHeaderPolicy(DEFAULT_ALLOWED_ORIGIN);
    }

    /** Policy allowing a single CORS origin. */
    public static SecurityHeaderPolicy forOrigin(String allowedOrigin) {
        return new SecurityHeaderPolicy(allowedOrigin);
    }

    /** Headers to set, in emission order. */
    public Map<String, String> headers() {
        return headers;
    }

    /** Headers to remove from every response. */
    public Set<String> removedHeaders() {
        return REMOVED_HEADERS;
    }

    public String allowedOrigin() {
        return headers.get("Access-Control-Allow-Origin");
    }
}
