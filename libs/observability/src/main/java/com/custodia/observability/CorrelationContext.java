package com.custodia.observability;

/**
 * Immutable correlation context that travels with one request or job.
 * <p>
 * Every entry point (HTTP request, scheduled sweep, workflow callback) establishes a
 * {@code CorrelationContext} so that log lines can be tied together and so that components
 * further down the call stack can learn who is acting on behalf of which tenant without having
 * those values threaded through every method signature.
 *
 * @param correlationId unique ID for the business flow (e.g. a destruction work order run)
 * @param tenantId      tenant ("company") the request is scoped to; nullable before resolution
 * @param actorId       acting principal; nullable for system-originated work
 * @param requestId     unique ID for this specific request
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String actorId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the acting principal. */
    public static final String MDC_ACTOR_ID = "actorId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given tenant and actor.
     */
    public CorrelationContext withPrincipal(String tenantId, String actorId) {
        return new CorrelationContext(correlationId, tenantId, actorId, requestId);
    }
}
