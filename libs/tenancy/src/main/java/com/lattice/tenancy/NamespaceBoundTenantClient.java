package com.lattice.tenancy;

import com.fasterxml.jackson.databind.JsonNode;
import com.lattice.common.LatticeException;
import com.lattice.observability.SpanHelper;
import io.opentelemetry.api.trace.SpanKind;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TenantClient} that sends every operation to the namespace of its {@link TenantContext}.
 */
final class NamespaceBoundTenantClient implements TenantClient {

    private final TenantContext context;
    private final GraphTransport transport;
    private final SpanHelper spans;

    NamespaceBoundTenantClient(TenantContext context, GraphTransport transport, SpanHelper spans) {
        this.context = context;
        this.transport = transport;
        this.spans = spans;
    }

    @Override
    public JsonNode execute(String query, Map<String, Object> variables) {
        Map<String, String> attributes = Map.of(
                "tenant.id", context.tenantId(),
                "tenant.namespace", context.namespaceLabel());
        return spans.inSpan("graph.execute", SpanKind.CLIENT, attributes, () -> {
            try {
                return transport.execute(context.namespace(), query, variables == null ? Map.of() : variables);
            } catch (LatticeException e) {
                throw e;
            } catch (RuntimeException e) {
                throw LatticeException.backend("execute",
                                "Graph operation failed for tenant " + context.tenantId()
                                        + " in namespace " + context.namespaceLabel() + ": " + e.getMessage(), e);
            }
        });
    }

    @Override
    public String tenantId() {
        return context.tenantId();
    }

    @Override
    public Optional<String> namespace() {
        return context.boundNamespace();
    }

    TenantContext context() {
        return context;
    }
}
