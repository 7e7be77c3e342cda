package com.todochat.pipeline.ratelimit;

/**
 * Outcome of one admission check.
 *
 * @param allowed   whether a token was spent and the request may proceed
 * @param remaining whole tokens left in the client's bucket right after the check
 * @param limit     configured requests per minute
 */
public record RateLimitDecision(boolean allowed, long remaining, int limit) {
}
