package com.todochat.chatapi.config;

import com.todochat.pipeline.ratelimit.RateLimitSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request pipeline settings, bound from {@code todochat.pipeline.*}.
 *
 * <pre>
 * todochat:
 *   pipeline:
 *     requests-per-minute: 60
 *     burst-capacity: 10
 *     cors-allowed-origin: "*"
 *     exempt-paths: [/health, /ready, /metrics]
 *     bucket-idle-timeout: 10m
 *     sweep-interval: 1m
 * </pre>
 *
 * <p>Zero or missing numbers and durations fall back to the defaults shown. Negative values fail
 * start-up.
 *
 * @param requestsPerMinute sustained per-client rate
 * @param burstCapacity     requests a fresh client may send at once
 * @param corsAllowedOrigin value of {@code Access-Control-Allow-Origin}
 * @param exemptPaths       paths that bypass rate limiting
 * @param bucketIdleTimeout buckets idle this long are dropped by the sweeper
 * @param sweepInterval     delay between sweeps
 */
@ConfigurationProperties(prefix = "todochat.pipeline")
@Validated
public record PipelineProperties(
        @PositiveOrZero int requestsPerMinute,
        @PositiveOrZero int burstCapacity,
        @NotBlank String corsAllowedOrigin,
        List<String> exemptPaths,
        Duration bucketIdleTimeout,
        Duration sweepInterval) {

    public static final Duration DEFAULT_BUCKET_IDLE_TIMEOUT = Duration.ofMinutes(10);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

    public PipelineProperties {
        if (requestsPerMinute == 0) {
            requestsPerMinute = RateLimitSettings.DEFAULT_REQUESTS_PER_MINUTE;
        }
        if (burstCapacity == 0) {
            burstCapacity = RateLimitSettings.DEFAULT_BURST_CAPACITY;
        }
        if (corsAllowedOrigin == null || corsAllowedOrigin.isBlank()) {
            corsAllowedOrigin = "*";
        }
        exemptPaths = exemptPaths == null ? List.copyOf(RateLimitSettings.DEFAULT_EXEMPT_PATHS) : List.copyOf(exemptPaths);
        if (bucketIdleTimeout == null || bucketIdleTimeout.isZero() || bucketIdleTimeout.isNegative()) {
            bucketIdleTimeout = DEFAULT_BUCKET_IDLE_TIMEOUT;
        }
        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            sweepInterval = DEFAULT_SWEEP_INTERVAL;
        }
    }

    /** Rate-limit settings for the pipeline. */
    public RateLimitSettings rateLimitSettings() {
        return new RateLimitSettings(requestsPerMinute, burstCapacity, Set.copyOf(exemptPaths));
    }
}
