package com.todochat.pipeline.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * JSON error payload shared by every error response the service produces.
 *
 * @param error             stable machine-readable code, e.g. {@code rate_limit_exceeded}
 * @param message           human-readable message, safe to show callers
 * @param retryAfterSeconds seconds to wait before retrying (429 only)
 * @param detail            exception summary (500 with {@link ErrorDetailLevel#FULL} only)
 * @param correlationId     correlation ID of the failed request, when known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"error", "message", "retry_after", "detail", "correlation_id"})
public record ErrorBody(
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("retry_after") Long retryAfterSeconds,
        @JsonProperty("detail") String detail,
        @JsonProperty("correlation_id") String correlationId
) {
}
