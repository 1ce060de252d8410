package com.lattice.tenancy;

import com.lattice.common.LatticeException;
import com.lattice.observability.CorrelationContextHolder;
import com.lattice.observability.SpanHelper;
import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.TenantCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds tenant-bound graph clients from the detected capabilities.
 *
 * <p>{@link #bindNamespace} is the only place a tenant is mapped to a namespace:
 *
 * <pre>
 * namespacesSupported | tenant       | namespace
 * --------------------+--------------+----------------------------------
 * false               | any          | default (tenant id kept for logs)
 * true                | default      | default
 * true                | test-tenant  | fixed test namespace
 * true                | other        | TenantManager, created on first use
 * </pre>
 */
public final class AdaptiveTenantClientFactory {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveTenantClientFactory.class);

    private final CapabilityCache capabilities;
    private final TenantManager tenants;
    private final NamespaceSettings namespaces;
    private final GraphTransport transport;
    private final SpanHelper spans;

    public AdaptiveTenantClientFactory(
            CapabilityCache capabilities,
            TenantManager tenants,
            NamespaceSettings namespaces,
            GraphTransport transport,
            SpanHelper spans) {
        if (capabilities == null || tenants == null || namespaces == null || transport == null) {
            throw new IllegalArgumentException("capabilities, tenants, namespaces and transport are required");
        }
        this.capabilities = capabilities;
        this.tenants = tenants;
        this.namespaces = namespaces;
        this.transport = transport;
        this.spans = spans == null ? SpanHelper.noop() : spans;
    }

    /**
     * Client for {@code tenantId}, for operations that write. Resolution failures propagate.
     */
    public TenantClient createClientFromContext(String tenantId) {
        return clientFor(resolveContext(tenantId, AccessMode.WRITE));
    }

    /**
     * Resolves the tenant context and records it on the current correlation context.
     *
     * <p>With {@link AccessMode#READ} a failed resolution degrades to the default tenant and is
     * logged at WARN; with {@link AccessMode#WRITE} it propagates.
     */
    public TenantContext resolveContext(String tenantId, AccessMode access) {
        String requested = tenantId == null || tenantId.isBlank() ? SystemTenants.DEFAULT_TENANT : tenantId;
        TenantCapabilities caps = capabilities.ensureDetected();
        TenantContext context;
        try {
            context = bindNamespace(requested, caps);
        } catch (LatticeException e) {
            if (access == AccessMode.WRITE) {
                throw e;
            }
            log.warn("Tenant {} could not be resolved ({}); reading from the default tenant",
                    requested, e.kind());
            context = TenantContext.defaultContext();
        }
        TenantContext resolved = context;
        CorrelationContextHolder.update(current -> current.withTenant(
                resolved.tenantId(), resolved.namespaceLabel(), caps.mode().wireName()));
        return resolved;
    }

    /** Maps a tenant to its namespace under {@code caps}. */
    public TenantContext bindNamespace(String tenantId, TenantCapabilities caps) {
        if (!caps.namespacesSupported()) {
            if (!SystemTenants.isDefault(tenantId)) {
                log.debug("Namespaces unsupported; tenant {} uses the default namespace", tenantId);
            }
            return TenantContext.of(tenantId, null);
        }
        if (SystemTenants.isDefault(tenantId)) {
            return TenantContext.defaultContext();
        }
        if (SystemTenants.isTest(tenantId)) {
            return TenantContext.of(tenantId, namespaces.testNamespace());
        }
        return TenantContext.of(tenantId, tenants.getTenantNamespace(tenantId).orElse(null));
    }

    /** Client bound to an already resolved context. */
    public TenantClient clientFor(TenantContext context) {
        return new NamespaceBoundTenantClient(context, transport, spans);
    }
}
