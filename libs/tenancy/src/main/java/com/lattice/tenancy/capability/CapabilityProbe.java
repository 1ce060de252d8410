package com.lattice.tenancy.capability;

/**
 * Determines the capabilities of the graph backend.
 *
 * <p>Implementations never throw for backend failures; they fail closed and report the failure in
 * {@link TenantCapabilities#error()}.
 */
@FunctionalInterface
public interface CapabilityProbe {

    TenantCapabilities detect();
}
