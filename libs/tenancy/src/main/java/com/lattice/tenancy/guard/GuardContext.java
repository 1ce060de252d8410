package com.lattice.tenancy.guard;

import com.lattice.tenancy.capability.TenantCapabilities;

/**
 * Everything a capability guard may look at.
 *
 * @param operation    logical operation being attempted (used in error reports)
 * @param capabilities current backend capabilities
 * @param tenantId     tenant the operation runs for
 * @param namespace    namespace the operation addresses (null: default namespace)
 */
public record GuardContext(
        String operation,
        TenantCapabilities capabilities,
        String tenantId,
        String namespace
) {

    public GuardContext {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be null or blank");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities must not be null");
        }
    }

    /** Context for operations that are not tied to a tenant. */
    public static GuardContext of(String operation, TenantCapabilities capabilities) {
        return new GuardContext(operation, capabilities, null, null);
    }
}
