package com.lattice.tenancy;

import java.util.List;

/**
 * Tenants that exist in every deployment and can never be deleted.
 */
public final class SystemTenants {

    /** Tenant used when a request names none. Always bound to the default namespace. */
    public static final String DEFAULT_TENANT = "default";

    /** Tenant used by test suites. Bound to a fixed, well-known namespace. */
    public static final String TEST_TENANT = "test-tenant";

    /** Both system tenants, default first. */
    public static final List<String> ALL = List.of(DEFAULT_TENANT, TEST_TENANT);

    private SystemTenants() {
        // utility class
    }

    public static boolean isDefault(String tenantId) {
        return tenantId == null || DEFAULT_TENANT.equals(tenantId);
    }

    public static boolean isTest(String tenantId) {
        return TEST_TENANT.equals(tenantId);
    }

    public static boolean isProtected(String tenantId) {
        return DEFAULT_TENANT.equals(tenantId) || TEST_TENANT.equals(tenantId);
    }
}
