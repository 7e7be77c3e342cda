package com.todochat.pipeline.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-client admission control backed by one {@link TokenBucket} per client identity.
 * <p>
 * Buckets are created lazily on a client's first request and live until
 * {@link #evictIdle(Duration)} removes them once idle and full again. Lookup-or-create and the refill/debit happen inside a
 * single {@link ConcurrentHashMap#compute} call, so two concurrent first requests from one client
 * share one bucket, and eviction cannot race a concurrent admission. Clients hashing to different
 * map bins never wait on each other.
 * <p>
 * A debited token is never refunded, even if the request is later abandoned.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final ConcurrentMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final RateLimitSettings settings;
    private final Clock clock;

    public RateLimiter(RateLimitSettings settings, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Spends one token from the client's bucket, creating the bucket if needed.
     *
     * @param clientId client identity (see {@link com.todochat.pipeline.ClientIdentity})
     * @return whether the request is admitted and how many tokens remain
     */
    public RateLimitDecision admit(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be null or blank");
        }
        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        buckets.compute(clientId, (id, existing) -> {
            TokenBucket bucket = existing != null ? existing : newBucket(id);
            boolean allowed = bucket.consume();
            decision.set(new RateLimitDecision(allowed, bucket.remaining(), settings.requestsPerMinute()));
            return bucket;
        });
        return decision.get();
    }

    /**
     * Removes buckets that have not seen a request for at least {@code idleFor} and have refilled
     * to capacity. A bucket still below capacity is kept, so a returning client is admitted
     * exactly as if it had never been evicted.
     *
     * @return number of buckets removed
     */
    public int evictIdle(Duration idleFor) {
        if (idleFor == null || idleFor.isNegative()) {
            throw new IllegalArgumentException("idleFor must be zero or positive");
        }
        Instant now = clock.instant();
        int removed = 0;
        for (String clientId : buckets.keySet()) {
            boolean[] evicted = {false};
            buckets.computeIfPresent(clientId, (id, bucket) -> {
                if (bucket.idleFor(now).compareTo(idleFor) >= 0 && bucket.isFullAt(now)) {
                    evicted[0] = true;
                    return null;
                }
                return bucket;
            });
            if (evicted[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} idle rate-limit buckets, {} remain", removed, buckets.size());
        }
        return removed;
    }

    /** Whole tokens currently left for a client, without spending or refilling. */
    public Optional<Long> remaining(String clientId) {
        TokenBucket bucket = clientId == null ? null : buckets.get(clientId);
        return bucket == null ? Optional.empty() : Optional.of(bucket.remaining());
    }

    /** Number of client identities with a live bucket. */
    public int trackedClients() {
        return buckets.size();
    }

    public RateLimitSettings settings() {
        return settings;
    }

    private TokenBucket newBucket(String clientId) {
        log.debug("Creating rate-limit bucket for client={}", clientId);
        return new TokenBucket(settings.burstCapacity(), settings.refillRatePerSecond(), clock);
    }
}
