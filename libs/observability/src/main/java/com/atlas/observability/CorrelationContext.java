package com.atlas.observability;

import java.util.UUID;

/**
 * Identifiers attached to one unit of work (an HTTP request or a consumed stream batch) and
 * mirrored into the SLF4J MDC so every log line carries them.
 *
 * @param correlationId id propagated from the caller's {@code X-Correlation-ID}, or generated
 * @param tenantId      tenant the work belongs to, if known
 * @param userId        authenticated caller, null for background work
 * @param requestId     id unique to this unit of work
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Starts a context for a new unit of work. A blank {@code correlationId} is replaced by a
     * random UUID.
     */
    public static CorrelationContext start(String correlationId) {
        String id = correlationId == null || correlationId.isBlank()
                ? UUID.randomUUID().toString()
                : correlationId;
        return new CorrelationContext(id, null, null, UUID.randomUUID().toString());
    }

    public CorrelationContext withTenant(String tenant) {
        return new CorrelationContext(correlationId, tenant, userId, requestId);
    }

    public CorrelationContext withUser(String user) {
        return new CorrelationContext(correlationId, tenantId, user, requestId);
    }
}
