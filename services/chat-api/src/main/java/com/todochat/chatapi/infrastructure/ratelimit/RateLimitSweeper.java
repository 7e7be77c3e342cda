package com.todochat.chatapi.infrastructure.ratelimit;

import com.todochat.chatapi.config.PipelineProperties;
import com.todochat.pipeline.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Periodically drops rate-limit buckets of clients that have gone quiet, so the bucket map does
 * not grow with every address ever seen.
 */
@Component
public class RateLimitSweeper implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(RateLimitSweeper.class);

    private final RateLimiter rateLimiter;
    private final PipelineProperties properties;

    public RateLimitSweeper(RateLimiter rateLimiter, PipelineProperties properties) {
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(this::sweep, properties.sweepInterval());
    }

    /** Evicts idle buckets once; returns how many were removed. */
    public int sweep() {
        int removed = rateLimiter.evictIdle(properties.bucketIdleTimeout());
        if (removed > 0) {
            log.info("Rate-limit sweep removed {} idle clients, {} still tracked", removed, rateLimiter.trackedClients());
        }
        return removed;
    }
}
