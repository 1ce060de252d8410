package com.lattice.tenancy;

import com.lattice.common.ErrorKind;
import com.lattice.common.LatticeError;
import com.lattice.common.LatticeException;
import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.TenantCapabilities;
import com.lattice.tenancy.guard.CapabilityGuards;
import com.lattice.tenancy.guard.GuardContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tenant lifecycle: namespace resolution, provisioning, deletion and listing.
 *
 * <p>Namespace ids are derived from the tenant id by {@link NamespaceIdGenerator}, so resolution
 * is stable across calls, instances and restarts. Creation is single-flight per tenant: concurrent
 * callers for the same tenant share one provisioning.
 */
public final class TenantManager {

    private static final Logger log = LoggerFactory.getLogger(TenantManager.class);

    private static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{2,49}");

    private final CapabilityCache capabilities;
    private final NamespaceIdGenerator ids;
    private final TenantRegistry registry;
    private final NamespaceProvisioner provisioner;
    private final Clock clock;
    private final Map<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    public TenantManager(
            CapabilityCache capabilities,
            NamespaceIdGenerator ids,
            TenantRegistry registry,
            NamespaceProvisioner provisioner,
            Clock clock) {
        if (capabilities == null || ids == null || registry == null || provisioner == null) {
            throw new IllegalArgumentException("capabilities, ids, registry and provisioner are required");
        }
        this.capabilities = capabilities;
        this.ids = ids;
        this.registry = registry;
        this.provisioner = provisioner;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * The namespace {@code tenantId} maps to when namespaces are supported. Pure, no backend call.
     */
    public String resolveNamespace(String tenantId) {
        validateTenantId("resolveNamespace", tenantId);
        return ids.namespaceFor(tenantId);
    }

    /**
     * System tenants always exist. Other tenants exist when registered, or when namespaces are
     * supported and their derived namespace is reachable (re-registering them after a restart).
     */
    public boolean tenantExists(String tenantId) {
        if (SystemTenants.isDefault(tenantId) || SystemTenants.isTest(tenantId)) {
            return true;
        }
        if (registry.find(tenantId).isPresent()) {
            return true;
        }
        if (!capabilities.ensureDetected().namespacesSupported()) {
            return false;
        }
        String namespace = resolveNamespace(tenantId);
        if (!accessible("tenantExists", namespace)) {
            return false;
        }
        registry.register(new TenantRecord(tenantId, namespace, clock.instant()));
        return true;
    }

    /**
     * Provisions the namespace for {@code tenantId} and returns its id. Idempotent: an existing
     * tenant returns its namespace unchanged.
     *
     * @throws LatticeException {@link ErrorKind#NAMESPACE_NOT_SUPPORTED} without namespace support,
     *         {@link ErrorKind#INVALID_NODE_INPUT} for a malformed tenant id,
     *         {@link ErrorKind#BACKEND_ERROR} when provisioning fails
     */
    public String createTenant(String tenantId) {
        validateTenantId("createTenant", tenantId);
        TenantCapabilities caps = capabilities.ensureDetected();
        CapabilityGuards.requireNamespaceSupport()
                .check(new GuardContext("createTenant", caps, tenantId, null))
                .orThrow();
        if (SystemTenants.isDefault(tenantId)) {
            return ids.settings().defaultNamespace();
        }

        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> running = inFlight.putIfAbsent(tenantId, mine);
        if (running != null) {
            log.debug("Joining in-flight creation of tenant {}", tenantId);
            return await(running);
        }
        try {
            mine.complete(provisionTenant(tenantId));
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(tenantId, mine);
        }
        return mine.join();
    }

    /**
     * Deprovisions a tenant's namespace.
     *
     * @throws LatticeException {@link ErrorKind#PROTECTED_TENANT} for system tenants, whatever the
     *         capabilities; {@link ErrorKind#NAMESPACE_NOT_SUPPORTED} without namespace support;
     *         {@link ErrorKind#TENANT_NOT_FOUND} for unknown tenants
     */
    public void deleteTenant(String tenantId) {
        if (SystemTenants.isProtected(tenantId)) {
            throw new LatticeException(LatticeError.of(
                            ErrorKind.PROTECTED_TENANT,
                            "deleteTenant",
                            "Cannot delete system tenant: " + tenantId,
                            "System tenants are required by every deployment")
                    .with("tenantId", tenantId));
        }
        validateTenantId("deleteTenant", tenantId);
        TenantCapabilities caps = capabilities.ensureDetected();
        CapabilityGuards.requireNamespaceSupport()
                .check(new GuardContext("deleteTenant", caps, tenantId, null))
                .orThrow();
        if (!tenantExists(tenantId)) {
            throw new LatticeException(LatticeError.of(
                            ErrorKind.TENANT_NOT_FOUND,
                            "deleteTenant",
                            "Tenant not found: " + tenantId,
                            "List tenants to see which ones exist")
                    .with("tenantId", tenantId));
        }
        String namespace = resolveNamespace(tenantId);
        try {
            provisioner.deprovision(namespace);
        } catch (LatticeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw LatticeException.backend("deleteTenant",
                    "Failed to deprovision namespace " + namespace + " for tenant " + tenantId, e);
        }
        registry.remove(tenantId);
        log.info("Deleted tenant {} (namespace {})", tenantId, namespace);
    }

    /**
     * Namespace a tenant's operations should be bound to. Empty means the default namespace: the
     * default tenant, or any tenant when namespaces are unsupported. Unknown tenants are created
     * on first use.
     */
    public Optional<String> getTenantNamespace(String tenantId) {
        if (SystemTenants.isDefault(tenantId)) {
            return Optional.empty();
        }
        if (!capabilities.ensureDetected().namespacesSupported()) {
            return Optional.empty();
        }
        if (SystemTenants.isTest(tenantId)) {
            return Optional.of(ids.settings().testNamespace());
        }
        Optional<TenantRecord> known = registry.find(tenantId);
        if (known.isPresent()) {
            return Optional.of(known.get().namespace());
        }
        return Optional.of(createTenant(tenantId));
    }

    /** Description of one tenant under the current capabilities. */
    public TenantInfo getTenantInfo(String tenantId) {
        TenantCapabilities caps = capabilities.ensureDetected();
        String namespace = namespaceUnder(caps, tenantId);
        boolean exists = tenantExists(tenantId);
        TenantHealth health = exists ? health(namespace) : TenantHealth.UNKNOWN;
        return new TenantInfo(tenantId, namespace, exists,
                SystemTenants.isDefault(tenantId), SystemTenants.isTest(tenantId),
                health, caps.mode().wireName());
    }

    /**
     * System tenants followed by registered tenants, each listed once. A tenant whose lookup fails
     * is logged and left out.
     */
    public List<TenantInfo> listTenants() {
        Set<String> tenantIds = new LinkedHashSet<>(SystemTenants.ALL);
        registry.all().forEach(record -> tenantIds.add(record.tenantId()));
        List<TenantInfo> result = new ArrayList<>(tenantIds.size());
        for (String tenantId : tenantIds) {
            try {
                result.add(getTenantInfo(tenantId));
            } catch (LatticeException e) {
                log.warn("Skipping tenant {} in listing: {}", tenantId, e.getMessage());
            }
        }
        return result;
    }

    private String provisionTenant(String tenantId) {
        Optional<TenantRecord> known = registry.find(tenantId);
        if (known.isPresent()) {
            return known.get().namespace();
        }
        String namespace = ids.namespaceFor(tenantId);
        Optional<TenantRecord> owner = registry.findByNamespace(namespace);
        if (owner.isPresent() && !owner.get().tenantId().equals(tenantId)) {
            throw new LatticeException(LatticeError.of(
                            ErrorKind.BACKEND_ERROR,
                            "createTenant",
                            "Namespace " + namespace + " is already owned by tenant " + owner.get().tenantId(),
                            "Choose a different tenant id")
                    .with("tenantId", tenantId)
                    .with("namespace", namespace));
        }
        ProvisionOutcome outcome;
        try {
            outcome = provisioner.provision(namespace);
        } catch (LatticeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw LatticeException.backend("createTenant",
                    "Failed to provision namespace " + namespace + " for tenant " + tenantId, e);
        }
        registry.register(new TenantRecord(tenantId, namespace, clock.instant()));
        log.info("Tenant {} ready in namespace {} ({})", tenantId, namespace, outcome);
        return namespace;
    }

    private String namespaceUnder(TenantCapabilities caps, String tenantId) {
        if (!caps.namespacesSupported() || SystemTenants.isDefault(tenantId)) {
            return ids.settings().defaultNamespace();
        }
        return resolveNamespace(tenantId);
    }

    private TenantHealth health(String namespace) {
        try {
            return provisioner.isAccessible(namespace) ? TenantHealth.HEALTHY : TenantHealth.NOT_ACCESSIBLE;
        } catch (RuntimeException e) {
            log.warn("Health check of namespace {} failed: {}", namespace, e.getMessage());
            return TenantHealth.ERROR;
        }
    }

    private boolean accessible(String operation, String namespace) {
        try {
            return provisioner.isAccessible(namespace);
        } catch (LatticeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw LatticeException.backend(operation, "Failed to check namespace " + namespace, e);
        }
    }

    private static String await(CompletableFuture<String> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static void validateTenantId(String operation, String tenantId) {
        if (tenantId == null || !TENANT_ID.matcher(tenantId).matches()) {
            throw new LatticeException(LatticeError.of(
                            ErrorKind.INVALID_NODE_INPUT,
                            operation,
                            "Invalid tenant id: " + tenantId,
                            "Tenant ids are 3-50 characters: letters, digits, '-' and '_',"
                                    + " starting with a letter or digit")
                    .with("tenantId", tenantId));
        }
    }
}
