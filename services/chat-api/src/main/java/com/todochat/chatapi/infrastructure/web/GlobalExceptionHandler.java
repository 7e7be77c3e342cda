package com.todochat.chatapi.infrastructure.web;

import com.todochat.chatapi.config.ServiceProperties;
import com.todochat.observability.CorrelationContextHolder;
import com.todochat.pipeline.error.ErrorBodies;
import com.todochat.pipeline.error.ErrorBody;
import com.todochat.pipeline.error.ErrorDetailLevel;
import com.todochat.pipeline.error.ErrorResponseMiddleware;
import com.todochat.security.ForbiddenException;
import com.todochat.security.UnauthorizedException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions thrown by controllers to the same JSON error bodies the pipeline produces.
 *
 * <pre>
 * {
 *   "error": "unauthorized",
 *   "message": "Invalid or expired token",
 *   "correlation_id": "abc-123"
 * }
 * </pre>
 *
 * <p>Spring MVC's own client errors (unknown route, wrong method) keep their status and get a body
 * in the same shape.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorDetailLevel detailLevel;

    public GlobalExceptionHandler(ServiceProperties service) {
        this.detailLevel = ErrorDetailLevel.forEnvironment(service.environment());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorBody> handleUnauthorized(UnauthorizedException ex) {
        log.warn("Unauthorized: reason={}", ex.reason());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(ErrorResponseMiddleware.WWW_AUTHENTICATE_HEADER, "Bearer")
                .body(ErrorBodies.unauthorized(correlationId()));
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorBody> handleForbidden(ForbiddenException ex) {
        log.warn("Forbidden: principal={} owner={}", ex.principalId(), ex.resourceOwnerId());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ErrorBodies.forbidden(correlationId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse frameworkError && frameworkError.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = frameworkError.getStatusCode();
            log.warn("Client error {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status).body(clientError(status, ex));
        }
        log.error("Internal server error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBodies.internalError(ex, detailLevel, correlationId()));
    }

    private ErrorBody clientError(HttpStatusCode status, Exception ex) {
        HttpStatus known = HttpStatus.resolve(status.value());
        String error = known != null
                ? known.name().toLowerCase(Locale.ROOT)
                : "http_" + status.value();
        String message = known != null ? known.getReasonPhrase() : ex.getMessage();
        return new ErrorBody(error, message, null, null, correlationId());
    }

    private static String correlationId() {
        return CorrelationContextHolder.currentCorrelationId().orElse(null);
    }
}
