package com.todochat.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable correlation context that follows one request through the pipeline and into any
 * downstream call it makes.
 * <p>
 * The pipeline establishes a {@code CorrelationContext} when a request enters, and the values are
 * copied into SLF4J MDC so every log line written while the request runs carries them.
 *
 * @param correlationId caller-supplied or generated identifier for the request
 * @param userId        authenticated principal id (null until authentication succeeds)
 * @param clientAddress client identity as seen by the pipeline (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String clientAddress
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the authenticated user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the client address. */
    public static final String MDC_CLIENT_ADDRESS = "clientAddress";

    /** Every MDC key a context may populate. */
    public static final List<String> MDC_KEYS = List.of(MDC_CORRELATION_ID, MDC_USER_ID, MDC_CLIENT_ADDRESS);

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /** Returns a copy of this context bound to the given authenticated user. */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, clientAddress);
    }

    /** The MDC entries for this context; keys whose value is unknown are left out. */
    public Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        if (userId != null) {
            entries.put(MDC_USER_ID, userId);
        }
        if (clientAddress != null) {
            entries.put(MDC_CLIENT_ADDRESS, clientAddress);
        }
        return entries;
    }
}
