package com.lattice.tenancy;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tenants known to this process. Namespace IDs are derived, not stored, so losing this registry on
 * restart loses no mapping; tenants are re-registered when their namespace is found reachable.
 */
public final class TenantRegistry {

    private final Map<String, TenantRecord> tenants = new ConcurrentHashMap<>();

    /**
     * Registers {@code tenant} unless a record for the same tenant exists.
     *
     * @return the record now in the registry
     */
    public TenantRecord register(TenantRecord tenant) {
        TenantRecord existing = tenants.putIfAbsent(tenant.tenantId(), tenant);
        return existing != null ? existing : tenant;
    }

    public Optional<TenantRecord> find(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    /** The tenant that owns {@code namespace}, if any. */
    public Optional<TenantRecord> findByNamespace(String namespace) {
        return tenants.values().stream()
                .filter(record -> record.namespace().equals(namespace))
                .findFirst();
    }

    public boolean remove(String tenantId) {
        return tenants.remove(tenantId) != null;
    }

    /** All records ordered by tenant ID. */
    public List<TenantRecord> all() {
        return tenants.values().stream()
                .sorted(Comparator.comparing(TenantRecord::tenantId))
                .toList();
    }

    public int size() {
        return tenants.size();
    }
}
