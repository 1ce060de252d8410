package com.lattice.tenancy;

/**
 * Namespace identifiers reserved by the deployment.
 *
 * @param defaultNamespace namespace of the default tenant (also the only namespace in OSS mode)
 * @param testNamespace    fixed namespace of {@link SystemTenants#TEST_TENANT}
 * @param prefix           prefix prepended to generated namespace numbers
 */
public record NamespaceSettings(String defaultNamespace, String testNamespace, String prefix) {

    public NamespaceSettings {
        if (defaultNamespace == null || defaultNamespace.isBlank()) {
            defaultNamespace = "0x0";
        }
        if (testNamespace == null || testNamespace.isBlank()) {
            testNamespace = "0x1";
        }
        if (prefix == null) {
            prefix = "0x";
        }
        if (defaultNamespace.equals(testNamespace)) {
            throw new IllegalArgumentException("testNamespace must differ from defaultNamespace");
        }
    }

    public static NamespaceSettings defaults() {
        return new NamespaceSettings(null, null, null);
    }
}
