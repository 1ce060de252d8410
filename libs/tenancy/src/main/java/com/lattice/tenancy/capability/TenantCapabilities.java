package com.lattice.tenancy.capability;

import java.time.Instant;
import java.util.Optional;

/**
 * What the graph backend can actually do, as determined by a {@link CapabilityProbe}.
 *
 * <p>Immutable. Lives in {@link CapabilityCache} until an explicit re-initialization.
 *
 * @param enterpriseDetected  enterprise features are active on the backend
 * @param namespacesSupported namespace-scoped operations succeed
 * @param licenseType         license classification from cluster metadata
 * @param licenseExpiry       license expiry (null when unknown or absent)
 * @param detectedAt          when the probe completed
 * @param error               probe failure description (null when detection succeeded)
 */
public record TenantCapabilities(
        boolean enterpriseDetected,
        boolean namespacesSupported,
        LicenseType licenseType,
        Instant licenseExpiry,
        Instant detectedAt,
        String error
) {

    public TenantCapabilities {
        if (licenseType == null) {
            licenseType = LicenseType.UNKNOWN;
        }
        if (detectedAt == null) {
            throw new IllegalArgumentException("detectedAt must not be null");
        }
    }

    /**
     * Least-capable capabilities, used whenever probing fails.
     *
     * @param error      what went wrong
     * @param detectedAt when the failure was observed
     */
    public static TenantCapabilities failClosed(String error, Instant detectedAt) {
        return new TenantCapabilities(false, false, LicenseType.UNKNOWN, null, detectedAt,
                error == null || error.isBlank() ? "capability detection failed" : error);
    }

    public DeploymentMode mode() {
        return DeploymentMode.of(enterpriseDetected, namespacesSupported);
    }

    /** True when these capabilities are a fail-closed fallback rather than a detection result. */
    public boolean failed() {
        return error != null;
    }

    public Optional<Instant> licenseExpiryAsOptional() {
        return Optional.ofNullable(licenseExpiry);
    }
}
