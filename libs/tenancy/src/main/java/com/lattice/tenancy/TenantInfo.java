package com.lattice.tenancy;

/**
 * Tenant description returned by {@link TenantManager#getTenantInfo} and
 * {@link TenantManager#listTenants()}.
 *
 * @param tenantId      tenant identifier
 * @param namespace     namespace id the tenant resolves to under the current capabilities
 * @param exists        the tenant is registered or its namespace is reachable
 * @param defaultTenant tenant is the default tenant
 * @param testTenant    tenant is the test tenant
 * @param health        namespace accessibility
 * @param mode          deployment mode wire name at the time of the lookup
 */
public record TenantInfo(
        String tenantId,
        String namespace,
        boolean exists,
        boolean defaultTenant,
        boolean testTenant,
        TenantHealth health,
        String mode
) {}
