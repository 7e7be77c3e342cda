package com.todochat.observability;

import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;

/**
 * Per-thread home of the current request's {@link CorrelationContext}.
 * <p>
 * Whatever is stored here is mirrored into the SLF4J MDC under {@link CorrelationContext#MDC_KEYS},
 * which is how the logback pattern picks up {@code %X{correlationId}} and {@code %X{userId}}.
 * The pipeline sets the context when a request enters and clears it on the way out, so the
 * holder is only populated on the thread serving the request.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * Installs {@code context} for this thread, replacing any previous one.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        Map<String, String> entries = context.mdcEntries();
        for (String key : CorrelationContext.MDC_KEYS) {
            String value = entries.get(key);
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /** Correlation id of the request this thread is serving, if any. */
    public static Optional<String> currentCorrelationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /**
     * Records the authenticated principal on the current context. Does nothing outside a
     * request.
     */
    public static void bindUser(String userId) {
        get().ifPresent(context -> set(context.withUserId(userId)));
    }

    public static void clear() {
        CURRENT.remove();
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }
}
