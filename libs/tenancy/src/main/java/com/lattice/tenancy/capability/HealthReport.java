package com.lattice.tenancy.capability;

import java.util.List;

/**
 * Backend health as reported by its health endpoint.
 *
 * @param version            backend version string (nullable)
 * @param enterpriseFeatures active enterprise feature names ({@code ee_features})
 * @param enterpriseFlag     the backend advertises enterprise mode or license data outside the
 *                           feature list
 */
public record HealthReport(String version, List<String> enterpriseFeatures, boolean enterpriseFlag) {

    public HealthReport {
        enterpriseFeatures = enterpriseFeatures == null ? List.of() : List.copyOf(enterpriseFeatures);
    }

    public boolean hasEnterpriseFeatures() {
        return enterpriseFlag || !enterpriseFeatures.isEmpty();
    }
}
