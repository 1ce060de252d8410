package com.lattice.tenancy.capability;

import java.time.Instant;

/**
 * License block of the backend's cluster state.
 *
 * @param present whether the state contained a license block at all
 * @param enabled license flag
 * @param user    licensee; empty for trial licenses
 * @param expiry  expiry instant (nullable)
 */
public record LicenseReport(boolean present, boolean enabled, String user, Instant expiry) {

    /** No license block in the cluster state. */
    public static LicenseReport absent() {
        return new LicenseReport(false, false, null, null);
    }

    /**
     * Absent or disabled means OSS only; enabled without a licensee is a trial; anything else is a
     * full enterprise license.
     */
    public LicenseType type() {
        if (!present || !enabled) {
            return LicenseType.OSS_ONLY;
        }
        if (user == null || user.isEmpty()) {
            return LicenseType.OSS_TRIAL;
        }
        return LicenseType.ENTERPRISE_LICENSED;
    }
}
