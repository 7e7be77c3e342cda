package com.todochat.pipeline.ratelimit;

/**
 * Signals that a client has exhausted its bucket. Rendered as 429 Too Many Requests.
 */
public class RateLimitExceededException extends RuntimeException {

    /** Advertised wait before retrying; a fixed hint, not computed from the bucket. */
    public static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    private final String clientId;
    private final int limit;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String clientId, int limit) {
        this(clientId, limit, DEFAULT_RETRY_AFTER_SECONDS);
    }

    public RateLimitExceededException(String clientId, int limit, long retryAfterSeconds) {
        super("Maximum " + limit + " requests per minute allowed");
        this.clientId = clientId;
        this.limit = limit;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String clientId() {
        return clientId;
    }

    public int limit() {
        return limit;
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
