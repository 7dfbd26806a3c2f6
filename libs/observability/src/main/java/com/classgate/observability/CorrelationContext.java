package com.classgate.observability;

/**
 * Immutable correlation context for one request.
 * <p>
 * Established when a request enters the service and mirrored into the SLF4J MDC so every log
 * line of the request carries the same identifiers.
 *
 * @param correlationId id shared by every log line of a request; echoed to the client
 * @param userId        authenticated user, once a bearer token has verified (nullable)
 */
public record CorrelationContext(String correlationId, String userId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context for a request nobody has authenticated yet. */
    public static CorrelationContext anonymous(String correlationId) {
        return new CorrelationContext(correlationId, null);
    }

    /** Same correlation, attributed to {@code userId}. */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId);
    }
}
