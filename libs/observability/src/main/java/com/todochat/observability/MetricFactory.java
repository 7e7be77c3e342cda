package com.todochat.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Meter source for Todo Chat services. Every meter it hands out carries a
 * {@value #TAG_SERVICE} tag with the owning service's name, so dashboards can split the shared
 * HTTP metrics by service.
 * <p>
 * Extra tags are given as alternating key/value strings: {@code "method", "GET", "status", "200"}.
 * Asking twice for the same name and tags yields the same meter; for gauges, the same holder.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<String, AtomicLong> gaugeHolders = new ConcurrentHashMap<>();

    /**
     * @param registry    meter registry the service exports (Prometheus in production)
     * @param serviceName value of the {@value #TAG_SERVICE} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Counter for discrete events, e.g. completed requests by status. */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tagsOf(tags))
                .register(registry);
    }

    /** Latency timer. Publishes a percentile histogram so quantiles can be computed server-side. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tagsOf(tags))
                .publishPercentileHistogram()
                .register(registry);
    }

    /**
     * Returns the value holder behind a gauge, registering the gauge on first use. The factory
     * keeps the holder reachable, so callers may drop their reference.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        Tags allTags = tagsOf(tags);
        return gaugeHolders.computeIfAbsent(name + allTags, key -> {
            AtomicLong holder = new AtomicLong();
            Gauge.builder(name, holder, AtomicLong::doubleValue)
                    .description(description)
                    .tags(allTags)
                    .register(registry);
            return holder;
        });
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tagsOf(String... extra) {
        if (extra.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs, got " + extra.length + " strings");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(extra);
    }
}
