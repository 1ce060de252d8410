package com.lattice.tenancy;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives a tenant's namespace identifier from the tenant ID alone.
 *
 * <p>Pure: the same tenant ID yields the same namespace in every process and after every restart,
 * with no registry lookup. Non-system tenants map into the 63-bit space above the two reserved
 * namespaces (0 and 1), using the first eight bytes of the SHA-256 digest.
 */
public final class NamespaceIdGenerator {

    /** Namespace numbers below this value belong to the system tenants. */
    static final long RESERVED = 2;

    private final NamespaceSettings settings;

    public NamespaceIdGenerator(NamespaceSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
    }

    /**
     * Namespace for {@code tenantId}. System tenants get their configured namespaces.
     */
    public String namespaceFor(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (SystemTenants.isDefault(tenantId)) {
            return settings.defaultNamespace();
        }
        if (SystemTenants.isTest(tenantId)) {
            return settings.testNamespace();
        }
        long digest = ByteBuffer.wrap(sha256(tenantId), 0, Long.BYTES).getLong() & Long.MAX_VALUE;
        long number = digest % (Long.MAX_VALUE - RESERVED) + RESERVED;
        return settings.prefix() + Long.toHexString(number);
    }

    public NamespaceSettings settings() {
        return settings;
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
