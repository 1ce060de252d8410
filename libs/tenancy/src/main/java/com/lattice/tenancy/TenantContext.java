package com.lattice.tenancy;

import java.util.Optional;

/**
 * Tenant an operation runs for, and the namespace it is bound to.
 *
 * <p>Created per operation, never persisted. A null namespace means the default namespace: either
 * the tenant is the default tenant, or the backend has no namespace isolation and the tenant ID is
 * kept only for logging.
 *
 * @param tenantId        logical tenant identifier
 * @param namespace       bound namespace, null for the default namespace
 * @param defaultTenant   tenant is {@link SystemTenants#DEFAULT_TENANT}
 * @param testTenant      tenant is {@link SystemTenants#TEST_TENANT}
 */
public record TenantContext(String tenantId, String namespace, boolean defaultTenant, boolean testTenant) {

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }

    public static TenantContext of(String tenantId, String namespace) {
        return new TenantContext(tenantId, namespace,
                SystemTenants.isDefault(tenantId), SystemTenants.isTest(tenantId));
    }

    /** The default tenant in the default namespace. */
    public static TenantContext defaultContext() {
        return of(SystemTenants.DEFAULT_TENANT, null);
    }

    public Optional<String> boundNamespace() {
        return Optional.ofNullable(namespace);
    }

    /** Namespace label for logs. */
    public String namespaceLabel() {
        return namespace == null ? "default" : namespace;
    }
}
