package com.todochat.pipeline.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Refillable credit balance for a single client.
 * <p>
 * The balance is a real number so that credit accrues between requests arriving less than a
 * second apart. Invariants: {@code 0 <= tokens <= capacity}, and refilling never lowers the
 * balance. If the clock steps backwards the refill is skipped and {@code lastRefill} is kept.
 * <p>
 * Refill-then-debit is atomic: all state changes happen under the bucket's monitor.
 */
public final class TokenBucket {

    private final int capacity;
    private final double refillRatePerSecond;
    private final Clock clock;

    private double tokens;
    private Instant lastRefill;

    /**
     * Creates a full bucket.
     *
     * @param capacity            maximum balance, at least 1
     * @param refillRatePerSecond tokens credited per elapsed second, greater than 0
     * @param clock               time source for refills
     */
    public TokenBucket(int capacity, double refillRatePerSecond, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (!(refillRatePerSecond > 0) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException("refillRatePerSecond must be a positive finite number");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    /** Tries to spend one token. */
    public boolean consume() {
        return consume(1);
    }

    /**
     * Refills for the time elapsed since the last refill, then spends {@code requested} tokens if
     * the balance covers them. On failure the balance is left as refilled.
     *
     * @param requested number of tokens to spend, at least 1
     * @return true if the tokens were debited
     */
    public synchronized boolean consume(int requested) {
        if (requested < 1) {
            throw new IllegalArgumentException("requested must be at least 1");
        }
        refill();
        if (tokens >= requested) {
            tokens -= requested;
            return true;
        }
        return false;
    }

    /** Balance as of the last refill. */
    public synchronized double tokens() {
        return tokens;
    }

    /** Whole tokens available as of the last refill. */
    public synchronized long remaining() {
        return (long) Math.floor(tokens);
    }

    public synchronized Instant lastRefill() {
        return lastRefill;
    }

    /** How long this bucket has gone without a request, as of {@code now}. */
    public synchronized Duration idleFor(Instant now) {
        Duration idle = Duration.between(lastRefill, now);
        return idle.isNegative() ? Duration.ZERO : idle;
    }

    /**
     * Whether the balance would be back at capacity by {@code now}. Does not refill, so asking
     * has no effect on later admissions.
     */
    public synchronized boolean isFullAt(Instant now) {
        if (!now.isAfter(lastRefill)) {
            return tokens >= capacity;
        }
        double elapsedSeconds = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
        return tokens + elapsedSeconds * refillRatePerSecond >= capacity;
    }

    public int capacity() {
        return capacity;
    }

    public double refillRatePerSecond() {
        return refillRatePerSecond;
    }

    private void refill() {
        Instant now = clock.instant();
        if (!now.isAfter(lastRefill)) {
            return;
        }
        double elapsedSeconds = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
        tokens = Math.min(capacity, tokens + elapsedSeconds * refillRatePerSecond);
        lastRefill = now;
    }
}
