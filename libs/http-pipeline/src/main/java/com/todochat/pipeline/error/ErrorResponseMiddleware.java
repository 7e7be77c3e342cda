package com.todochat.pipeline.error;

import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.Middleware;
import com.todochat.pipeline.RequestContext;
import com.todochat.pipeline.RequestHandler;
import com.todochat.pipeline.ratelimit.RateLimitExceededException;
import com.todochat.pipeline.ratelimit.RateLimitMiddleware;
import com.todochat.security.ForbiddenException;
import com.todochat.security.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns exceptions escaping the inner stages into JSON error responses.
 * <ul>
 *   <li>{@link RateLimitExceededException}: 429 with {@code Retry-After} and rate-limit headers</li>
 *   <li>{@link UnauthorizedException}: 401 with {@code WWW-Authenticate: Bearer}</li>
 *   <li>{@link ForbiddenException}: 403</li>
 *   <li>anything else: 500, detail governed by {@link ErrorDetailLevel}</li>
 * </ul>
 * Client errors are logged at WARN without a stack trace; server errors at ERROR with one.
 */
public final class ErrorResponseMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponseMiddleware.class);

    public static final String RETRY_AFTER_HEADER = "Retry-After";
    public static final String WWW_AUTHENTICATE_HEADER = "WWW-Authenticate";

    private final ErrorDetailLevel detailLevel;

    public ErrorResponseMiddleware(ErrorDetailLevel detailLevel) {
        if (detailLevel == null) {
            throw new IllegalArgumentException("detailLevel must not be null");
        }
        this.detailLevel = detailLevel;
    }

    @Override
    public HttpResponse handle(HttpRequest request, RequestContext context, RequestHandler next) {
        try {
            return next.handle(request, context);
        } catch (RateLimitExceededException ex) {
            return rateLimited(ex, context);
        } catch (UnauthorizedException ex) {
            log.warn("Unauthorized method={} path={} reason={}", request.method(), request.path(), ex.reason());
            return HttpResponse.of(401, ErrorBodies.unauthorized(context.correlationId()))
                    .header(WWW_AUTHENTICATE_HEADER, "Bearer");
        } catch (ForbiddenException ex) {
            log.warn("Forbidden method={} path={} principal={} owner={}",
                    request.method(), request.path(), ex.principalId(), ex.resourceOwnerId());
            return HttpResponse.of(403, ErrorBodies.forbidden(context.correlationId()));
        } catch (Exception ex) {
            log.error("Unhandled error method={} path={}", request.method(), request.path(), ex);
            return HttpResponse.of(500, ErrorBodies.internalError(ex, detailLevel, context.correlationId()));
        }
    }

    private HttpResponse rateLimited(RateLimitExceededException ex, RequestContext context) {
        return HttpResponse.of(429, ErrorBodies.rateLimited(ex, context.correlationId()))
                .header(RETRY_AFTER_HEADER, String.valueOf(ex.retryAfterSeconds()))
                .header(RateLimitMiddleware.LIMIT_HEADER, String.valueOf(ex.limit()))
                .header(RateLimitMiddleware.REMAINING_HEADER, "0");
    }

    public ErrorDetailLevel detailLevel() {
        return detailLevel;
    }
}
