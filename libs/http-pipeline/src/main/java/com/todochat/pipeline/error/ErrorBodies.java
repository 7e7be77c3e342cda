package com.todochat.pipeline.error;

import com.todochat.pipeline.ratelimit.RateLimitExceededException;
import com.todochat.security.ForbiddenException;
import com.todochat.security.UnauthorizedException;

/**
 * Builds the {@link ErrorBody} for each failure category. Used by the pipeline's
 * {@link ErrorResponseMiddleware} and by framework-level exception handlers so both produce
 * identical payloads.
 */
public final class ErrorBodies {

    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String UNAUTHORIZED = "unauthorized";
    public static final String FORBIDDEN = "forbidden";
    public static final String INTERNAL_ERROR = "internal_error";

    public static final String INTERNAL_ERROR_MESSAGE = "An unexpected error occurred";

    private ErrorBodies() {
    }

    public static ErrorBody rateLimited(RateLimitExceededException ex, String correlationId) {
        return new ErrorBody(RATE_LIMIT_EXCEEDED, ex.getMessage(), ex.retryAfterSeconds(), null, correlationId);
    }

    public static ErrorBody unauthorized(String correlationId) {
        return new ErrorBody(UNAUTHORIZED, UnauthorizedException.PUBLIC_MESSAGE, null, null, correlationId);
    }

    public static ErrorBody forbidden(String correlationId) {
        return new ErrorBody(FORBIDDEN, ForbiddenException.PUBLIC_MESSAGE, null, null, correlationId);
    }

    public static ErrorBody internalError(Throwable failure, ErrorDetailLevel level, String correlationId) {
        String detail = level == ErrorDetailLevel.FULL && failure != null
                ? failure.getClass().getName() + ": " + failure.getMessage()
                : null;
        return new ErrorBody(INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE, null, detail, correlationId);
    }
}
