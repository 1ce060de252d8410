package com.lattice.tenancy.guard;

import com.lattice.common.ErrorKind;
import com.lattice.common.LatticeError;
import com.lattice.tenancy.SystemTenants;
import com.lattice.tenancy.capability.DeploymentMode;
import java.util.List;

/**
 * The canonical capability guards and the fold that chains them.
 *
 * <p>Guards turn a capability gap into a structured error instead of letting an operation silently
 * no-op or write into the wrong namespace. Each error carries a suggestion derived from the current
 * deployment mode.
 */
public final class CapabilityGuards {

    private CapabilityGuards() {
        // utility class
    }

    /**
     * Denies with {@link ErrorKind#ENTERPRISE_FEATURE_NOT_AVAILABLE} unless enterprise features are
     * active.
     */
    public static Guard requireEnterprise() {
        return context -> {
            if (context.capabilities().enterpriseDetected()) {
                return GuardResult.allow();
            }
            DeploymentMode mode = context.capabilities().mode();
            return GuardResult.deny(LatticeError.of(
                            ErrorKind.ENTERPRISE_FEATURE_NOT_AVAILABLE,
                            context.operation(),
                            "Enterprise feature not available: " + context.operation(),
                            enterpriseSuggestion(mode))
                    .with("currentMode", mode.wireName()));
        };
    }

    /**
     * Denies with {@link ErrorKind#NAMESPACE_NOT_SUPPORTED} unless namespace isolation works.
     */
    public static Guard requireNamespaceSupport() {
        return context -> {
            if (context.capabilities().namespacesSupported()) {
                return GuardResult.allow();
            }
            DeploymentMode mode = context.capabilities().mode();
            String namespace = context.namespace() != null ? context.namespace() : context.tenantId();
            return GuardResult.deny(LatticeError.of(
                            ErrorKind.NAMESPACE_NOT_SUPPORTED,
                            context.operation(),
                            "Namespace operation not supported: " + context.operation()
                                    + (namespace != null ? " (namespace: " + namespace + ")" : ""),
                            namespaceSuggestion(mode))
                    .with("namespace", namespace)
                    .with("currentMode", mode.wireName()));
        };
    }

    /**
     * The default tenant is always allowed; any other tenant needs namespace support.
     */
    public static Guard validateTenantContext() {
        Guard namespaces = requireNamespaceSupport();
        return context -> SystemTenants.isDefault(context.tenantId())
                ? GuardResult.allow()
                : namespaces.check(context);
    }

    /**
     * An explicit non-default namespace needs namespace support.
     *
     * @param defaultNamespace the backend's default namespace id
     */
    public static Guard validateNamespace(String defaultNamespace) {
        Guard namespaces = requireNamespaceSupport();
        return context -> context.namespace() == null || context.namespace().equals(defaultNamespace)
                ? GuardResult.allow()
                : namespaces.check(context);
    }

    /**
     * Folds guards left to right; the first denial wins and later guards are not evaluated.
     */
    public static Guard chain(List<Guard> guards) {
        Guard combined = context -> GuardResult.allow();
        for (Guard guard : guards) {
            combined = combined.andThen(guard);
        }
        return combined;
    }

    /** Varargs form of {@link #chain(List)}. */
    public static Guard chain(Guard... guards) {
        return chain(List.of(guards));
    }

    static String enterpriseSuggestion(DeploymentMode mode) {
        return switch (mode) {
            case ENTERPRISE_MULTI_TENANT, ENTERPRISE_SINGLE_TENANT ->
                    "Verify the enterprise license is valid and has not expired";
            case OSS_SINGLE_TENANT ->
                    "Run the graph backend with an enterprise license to use this operation";
        };
    }

    static String namespaceSuggestion(DeploymentMode mode) {
        return switch (mode) {
            case ENTERPRISE_SINGLE_TENANT ->
                    "Check namespace isolation configuration: enterprise features are active"
                            + " but namespace operations are not functional";
            case OSS_SINGLE_TENANT ->
                    "Upgrade to an enterprise graph backend with namespace support, or use the default tenant";
            case ENTERPRISE_MULTI_TENANT ->
                    "Re-run capability detection; namespace support was reported as available";
        };
    }
}
