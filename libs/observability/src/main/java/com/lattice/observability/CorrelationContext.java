package com.lattice.observability;

/**
 * Immutable per-operation context that ties log lines, spans and metrics to one inbound request
 * and the tenant it was resolved for.
 *
 * <p>Established by the HTTP boundary, enriched once the tenant context is resolved, and pushed into
 * SLF4J MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId unique ID for the request chain (propagated from {@code X-Correlation-ID})
 * @param tenantId      logical tenant the operation runs for (nullable until resolved)
 * @param namespace     backend namespace the tenant is bound to (nullable: default namespace)
 * @param mode          deployment mode string at the time of resolution (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String namespace,
        String mode
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the backend namespace. */
    public static final String MDC_NAMESPACE = "namespace";

    /** MDC key for the deployment mode. */
    public static final String MDC_MODE = "mode";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation ID; tenant data is filled in later. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /** Returns a copy bound to the given tenant, namespace and mode. */
    public CorrelationContext withTenant(String tenantId, String namespace, String mode) {
        return new CorrelationContext(correlationId, tenantId, namespace, mode);
    }
}
