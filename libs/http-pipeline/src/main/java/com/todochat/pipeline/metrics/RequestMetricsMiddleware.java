package com.todochat.pipeline.metrics;

import com.todochat.observability.MetricFactory;
import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.Middleware;
import com.todochat.pipeline.RequestContext;
import com.todochat.pipeline.RequestHandler;
import io.micrometer.core.instrument.Timer;

import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records request count, latency and in-flight requests through {@link MetricFactory}.
 * <p>
 * Requests to the scrape endpoint (by default {@value #METRICS_PATH}) are not measured. An
 * exception escaping the inner stages is counted with status 500 and rethrown.
 */
public final class RequestMetricsMiddleware implements Middleware {

    public static final String REQUESTS_TOTAL = "http.server.requests.total";
    public static final String REQUEST_DURATION = "http.server.request.duration";
    public static final String REQUESTS_ACTIVE = "http.server.requests.active";

    public static final String METRICS_PATH = "/metrics";

    private final MetricFactory metrics;
    private final Set<String> unmeteredPaths;
    private final AtomicLong active;

    public RequestMetricsMiddleware(MetricFactory metrics) {
        this(metrics, Set.of(METRICS_PATH));
    }

    /**
     * @param metrics        meter source
     * @param unmeteredPaths exact paths that are passed through without being measured
     */
    public RequestMetricsMiddleware(MetricFactory metrics, Set<String> unmeteredPaths) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
        this.unmeteredPaths = unmeteredPaths == null ? Set.of() : Set.copyOf(unmeteredPaths);
        this.active = metrics.gauge(REQUESTS_ACTIVE, "Requests currently being processed");
    }

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context, RequestHandler next) throws Exception {
        if (unmeteredPaths.contains(request.path())) {
            return next.handle(request, context);
        }

        active.incrementAndGet();
        Timer.Sample sample = Timer.start(metrics.registry());
        int status = 500;
        try {
            HttpResponse response = next.handle(request, context);
            status = response.status();
            return response;
        } finally {
            sample.stop(metrics.timer(REQUEST_DURATION, "HTTP request latency", "method", request.method()));
            metrics.counter(REQUESTS_TOTAL, "Total HTTP requests",
                    "method", request.method(), "status", String.valueOf(status)).increment();
            active.decrementAndGet();
        }
    }

    /** Requests currently inside this stage. */
    public long activeRequests() {
        return active.get();
    }
}
