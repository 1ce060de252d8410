package com.lattice.tenancy.capability;

/**
 * License state reported by the backend's cluster metadata.
 */
public enum LicenseType {

    OSS_ONLY("oss-only"),
    OSS_TRIAL("oss-trial"),
    ENTERPRISE_LICENSED("enterprise-licensed"),
    UNKNOWN("unknown");

    private final String wireName;

    LicenseType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in summaries and response bodies. */
    public String wireName() {
        return wireName;
    }

    /**
     * Whether the license unlocks enterprise features. A trial license does, until it expires.
     */
    public boolean isEnterprise() {
        return this == ENTERPRISE_LICENSED || this == OSS_TRIAL;
    }
}
