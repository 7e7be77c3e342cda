package com.todochat.pipeline.correlation;

import com.todochat.observability.CorrelationContext;
import com.todochat.observability.CorrelationContextHolder;
import com.todochat.observability.SensitiveDataRedactor;
import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.Middleware;
import com.todochat.pipeline.RequestContext;
import com.todochat.pipeline.RequestHandler;
import com.todochat.pipeline.ClientIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Outermost stage: assigns the correlation ID and writes the start and end records of every
 * request.
 * <p>
 * The inbound {@value #CORRELATION_ID_HEADER} is reused when present and not blank, otherwise a
 * random UUID is generated. The ID is stored on the {@link RequestContext}, published through
 * {@link CorrelationContextHolder} (and so SLF4J MDC) while the request runs, and echoed on the
 * response. A failure escaping the inner stages is logged at ERROR and rethrown unchanged.
 */
public final class CorrelationLoggingMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(CorrelationLoggingMiddleware.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final Clock clock;
    private final SensitiveDataRedactor redactor;
    private final Supplier<String> idGenerator;

    public CorrelationLoggingMiddleware(Clock clock) {
        this(clock, new SensitiveDataRedactor(), () -> UUID.randomUUID().toString());
    }

    public CorrelationLoggingMiddleware(Clock clock, SensitiveDataRedactor redactor, Supplier<String> idGenerator) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator must not be null");
        }
        this.clock = clock;
        this.redactor = redactor;
        this.idGenerator = idGenerator;
    }

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context, RequestHandler next) throws Exception {
        String correlationId = request.header(CORRELATION_ID_HEADER)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .orElseGet(idGenerator);
        String client = ClientIdentity.resolve(request);

        context.setCorrelationId(correlationId);
        CorrelationContextHolder.set(new CorrelationContext(correlationId, null, client));
        Instant started = clock.instant();
        try {
            log.info("request started method={} path={} query={} client={} correlationId={}",
                    request.method(), request.path(), redactor.redactParameters(request.queryParameters()),
                    client, correlationId);

            HttpResponse response;
            try {
                response = next.handle(request, context);
            } catch (Exception ex) {
                log.error("request failed method={} path={} durationMs={} error={} errorType={}",
                        request.method(), request.path(), elapsedMillis(started),
                        ex.getMessage(), ex.getClass().getSimpleName());
                throw ex;
            }

            response.header(CORRELATION_ID_HEADER, correlationId);
            log.info("request completed method={} path={} status={} durationMs={}",
                    request.method(), request.path(), response.status(), elapsedMillis(started));
            return response;
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private String elapsedMillis(Instant started) {
        Duration elapsed = Duration.between(started, clock.instant());
        double millis = elapsed.isNegative() ? 0.0 : elapsed.toNanos() / 1_000_000.0;
        return String.format(Locale.ROOT, "%.2f", millis);
    }
}
