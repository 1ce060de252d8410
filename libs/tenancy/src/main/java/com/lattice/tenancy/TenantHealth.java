package com.lattice.tenancy;

/** Result of checking whether a tenant's namespace answers queries. */
public enum TenantHealth {
    HEALTHY,
    NOT_ACCESSIBLE,
    ERROR,
    UNKNOWN
}
