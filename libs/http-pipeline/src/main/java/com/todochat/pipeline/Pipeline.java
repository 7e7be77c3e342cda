package com.todochat.pipeline;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered chain of {@link Middleware} in front of a terminal {@link RequestHandler}.
 * <p>
 * The first stage added is the outermost: it sees the request first and the response last.
 * A pipeline is immutable and thread-safe once built; each call to {@link #handle} gets its own
 * {@link RequestContext}.
 *
 * <pre>{@code
 * Pipeline pipeline = Pipeline.builder()
 *         .use(new CorrelationLoggingMiddleware(clock))
 *         .use(new SecurityHeadersMiddleware(SecurityHeaderPolicy.defaults()))
 *         .use(new RequestMetricsMiddleware(metricFactory))
 *         .use(new ErrorResponseMiddleware(ErrorDetailLevel.MINIMAL))
 *         .use(new RateLimitMiddleware(rateLimiter, settings))
 *         .build(routes);
 * }</pre>
 */
public final class Pipeline {

    private final RequestHandler chain;
    private final Clock clock;

    private Pipeline(List<Middleware> stages, RequestHandler terminal, Clock clock) {
        this.clock = clock;
        RequestHandler current = terminal;
        for (int i = stages.size() - 1; i >= 0; i--) {
            current = stages.get(i).wrap(current);
        }
        this.chain = current;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a request through every stage with a fresh context.
     *
     * @throws Exception whatever escapes the outermost stage
     */
    public HttpResponse handle(HttpRequest request) throws Exception {
        return handle(request, new RequestContext(clock.instant()));
    }

    /**
     * Runs a request with a context created by the caller, for transports that need to reach
     * the context from their own terminal handler.
     */
    public HttpResponse handle(HttpRequest request, RequestContext context) throws Exception {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        HttpResponse response = chain.handle(request, context);
        if (response == null) {
            throw new IllegalStateException("pipeline produced no response for " + request.method() + " " + request.path());
        }
        return response;
    }

    /** Creates a context stamped with this pipeline's clock. */
    public RequestContext newContext() {
        return new RequestContext(clock.instant());
    }

    public static final class Builder {

        private final List<Middleware> stages = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /** Appends a stage inside the ones already added. */
        public Builder use(Middleware middleware) {
            if (middleware == null) {
                throw new IllegalArgumentException("middleware must not be null");
            }
            stages.add(middleware);
            return this;
        }

        /** Clock used to stamp {@link RequestContext#receivedAt()}. */
        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock must not be null");
            }
            this.clock = clock;
            return this;
        }

        public Pipeline build(RequestHandler terminal) {
            if (terminal == null) {
                throw new IllegalArgumentException("terminal handler must not be null");
            }
            return new Pipeline(stages, terminal, clock);
        }
    }
}
