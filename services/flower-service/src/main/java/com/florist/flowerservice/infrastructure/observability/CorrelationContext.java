package com.florist.flowerservice.infrastructure.observability;

/**
 * Identifiers attached to one request and copied into SLF4J MDC while it is handled.
 *
 * @param correlationId id of the business flow, taken from {@code X-Correlation-ID} or generated
 * @param requestId id of this request alone (nullable)
 */
public record CorrelationContext(String correlationId, String requestId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
