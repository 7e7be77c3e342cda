package com.todochat.pipeline;

import com.todochat.security.AuthenticatedPrincipal;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable bag of per-request state, created when a request enters the {@link Pipeline} and
 * dropped when its response leaves.
 * <p>
 * A context is owned by the single task processing its request and is never shared between
 * requests, so it is not synchronized.
 */
public final class RequestContext {

    private final Instant receivedAt;
    private final Map<String, Object> attributes = new HashMap<>();
    private String correlationId;
    private AuthenticatedPrincipal principal;

    public RequestContext(Instant receivedAt) {
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt must not be null");
        }
        this.receivedAt = receivedAt;
    }

    /** When the request entered the pipeline. */
    public Instant receivedAt() {
        return receivedAt;
    }

    /** Correlation ID assigned by the correlation stage; null before that stage runs. */
    public String correlationId() {
        return correlationId;
    }

    public void setCorrelationId(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        this.correlationId = correlationId;
    }

    /** The authenticated principal, once the route layer has authenticated the request. */
    public Optional<AuthenticatedPrincipal> principal() {
        return Optional.ofNullable(principal);
    }

    public void setPrincipal(AuthenticatedPrincipal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        this.principal = principal;
    }

    /** Returns a stage-defined attribute, if set. */
    public <T> Optional<T> attribute(String name, Class<T> type) {
        Object value = attributes.get(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public void setAttribute(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("attribute name must not be null or blank");
        }
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
    }
}
