package com.lattice.tenancy.capability;

/**
 * Deployment mode derived from {@link TenantCapabilities}. Surfaced to clients in the
 * {@code X-Graph-Mode} header and the capability summary.
 */
public enum DeploymentMode {

    /** Enterprise backend with working namespace isolation. */
    ENTERPRISE_MULTI_TENANT("enterprise-multi-tenant"),

    /** Enterprise features detected but namespace operations are not functional. */
    ENTERPRISE_SINGLE_TENANT("enterprise-single-tenant"),

    /** OSS backend, or detection failed and the gateway fails closed. */
    OSS_SINGLE_TENANT("oss-single-tenant");

    private final String wireName;

    DeploymentMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Namespace support wins over the enterprise flag. */
    public static DeploymentMode of(boolean enterpriseDetected, boolean namespacesSupported) {
        if (namespacesSupported) {
            return ENTERPRISE_MULTI_TENANT;
        }
        return enterpriseDetected ? ENTERPRISE_SINGLE_TENANT : OSS_SINGLE_TENANT;
    }
}
