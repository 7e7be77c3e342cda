package com.todochat.pipeline.ratelimit;

import java.util.Set;

/**
 * Admission-control settings.
 *
 * @param requestsPerMinute sustained rate per client; also the advertised {@code X-RateLimit-Limit}
 * @param burstCapacity     bucket capacity, i.e. how many requests a fresh client may send at once
 * @param exemptPaths       exact paths that bypass rate limiting (probes)
 */
public record RateLimitSettings(int requestsPerMinute, int burstCapacity, Set<String> exemptPaths) {

    public static final int DEFAULT_REQUESTS_PER_MINUTE = 60;
    public static final int DEFAULT_BURST_CAPACITY = 10;
    public static final Set<String> DEFAULT_EXEMPT_PATHS = Set.of("/health", "/ready", "/metrics");

    public RateLimitSettings {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be at least 1");
        }
        if (burstCapacity < 1) {
            throw new IllegalArgumentException("burstCapacity must be at least 1");
        }
        exemptPaths = exemptPaths == null ? DEFAULT_EXEMPT_PATHS : Set.copyOf(exemptPaths);
    }

    public static RateLimitSettings defaults() {
        return new RateLimitSettings(DEFAULT_REQUESTS_PER_MINUTE, DEFAULT_BURST_CAPACITY, DEFAULT_EXEMPT_PATHS);
    }

    /** Tokens credited per second: {@code requestsPerMinute / 60}. */
    public double refillRatePerSecond() {
        return requestsPerMinute / 60.0;
    }

    public boolean isExempt(String path) {
        return path != null && exemptPaths.contains(path);
    }
}
