package com.lattice.tenancy.capability;

import java.time.Instant;

/**
 * Capability view handed to the routing layer and to capability-aware clients.
 *
 * @param namespacesSupported namespace isolation is available
 * @param enterpriseDetected  enterprise features are active
 * @param licenseType         license wire name
 * @param mode                deployment mode wire name
 * @param detectedAt          when detection completed (null while undetected)
 * @param state               detection lifecycle state
 * @param error               detection failure, if any
 */
public record CapabilitySummary(
        boolean namespacesSupported,
        boolean enterpriseDetected,
        String licenseType,
        String mode,
        Instant detectedAt,
        DetectionState state,
        String error
) {

    /** Summary of detected (or fail-closed) capabilities. */
    public static CapabilitySummary of(TenantCapabilities capabilities, DetectionState state) {
        return new CapabilitySummary(
                capabilities.namespacesSupported(),
                capabilities.enterpriseDetected(),
                capabilities.licenseType().wireName(),
                capabilities.mode().wireName(),
                capabilities.detectedAt(),
                state,
                capabilities.error());
    }

    /** Summary reported before the first detection has finished. */
    public static CapabilitySummary undetected(DetectionState state) {
        return new CapabilitySummary(false, false, LicenseType.UNKNOWN.wireName(),
                DeploymentMode.OSS_SINGLE_TENANT.wireName(), null, state, null);
    }
}
