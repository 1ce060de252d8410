package com.lattice.tenancy;

/**
 * How an operation uses its tenant context. Reads may fall back to the default tenant when tenant
 * resolution fails; writes may not.
 */
public enum AccessMode {
    READ,
    WRITE
}
