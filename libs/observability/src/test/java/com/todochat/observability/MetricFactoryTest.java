package com.todochat.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetricFactory}: validates metric creation with automatic service tags
 * and counter/timer/gauge operations.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "chat-api");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Nested
    @DisplayName("Meters")
    class Meters {

        @Test
        @DisplayName("counter carries the service tag and extra tags")
        void counterCarriesTags() {
            Counter counter = factory.counter("http.server.requests.total", "requests", "method", "GET");
            counter.increment();

            Counter found = registry.get("http.server.requests.total")
                    .tag("service", "chat-api")
                    .tag("method", "GET")
                    .counter();
            assertThat(found.count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("same name and tags resolve to the same counter")
        void counterIsReused() {
            factory.counter("c", "d", "status", "200").increment();
            factory.counter("c", "d", "status", "200").increment();

            assertThat(registry.get("c").tag("status", "200").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("timer records durations")
        void timerRecords() {
            Timer timer = factory.timer("http.server.request.duration", "latency");
            timer.record(Duration.ofMillis(15));

            assertThat(timer.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("gauge reflects the returned value holder")
        void gaugeTracksValue() {
            AtomicLong active = factory.gauge("http.server.requests.active", "in flight");
            active.set(3);

            assertThat(registry.get("http.server.requests.active").gauge().value()).isEqualTo(3.0);
            assertThat(factory.serviceName()).isEqualTo("chat-api");
        }

        @Test
        @DisplayName("asking for the same gauge twice returns the same holder")
        void gaugeHolderIsShared() {
            AtomicLong first = factory.gauge("http.server.requests.active", "in flight", "route", "/api");
            AtomicLong second = factory.gauge("http.server.requests.active", "in flight", "route", "/api");
            second.incrementAndGet();

            assertThat(first).isSameAs(second);
            assertThat(registry.get("http.server.requests.active").tag("route", "/api").gauge().value())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("timer publishes a percentile histogram to Prometheus")
        void timerPublishesHistogram() {
            PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
            Timer timer = new MetricFactory(prometheus, "chat-api")
                    .timer("http.server.request.duration", "latency", "method", "GET");
            timer.record(Duration.ofMillis(5));

            assertThat(prometheus.scrape())
                    .contains("http_server_request_duration_seconds_bucket{")
                    .contains("le=\"+Inf\"");
        }

        @Test
        @DisplayName("an odd number of tag strings is rejected")
        void oddTagsRejected() {
            assertThatThrownBy(() -> factory.counter("c", "d", "method"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("key/value pairs");
        }
    }
}
