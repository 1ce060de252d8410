package com.lattice.common;

/**
 * Discriminant for every failure the gateway reports to its callers.
 *
 * <p>Consumers switch over the kind without a {@code default} branch, so an unhandled new kind is
 * a compile error.
 */
public enum ErrorKind {

    /** The operation needs enterprise capabilities the detected backend lacks. */
    ENTERPRISE_FEATURE_NOT_AVAILABLE,

    /** Namespace isolation was requested but the backend cannot provide it. */
    NAMESPACE_NOT_SUPPORTED,

    /** The requested or derived hierarchy level does not exist. */
    INVALID_LEVEL,

    /** The node type is not permitted at the resolved level. */
    NODE_TYPE_NOT_ALLOWED,

    /** The referenced hierarchy does not exist. */
    HIERARCHY_NOT_FOUND,

    /** The node-creation request is malformed (duplicate ids, cyclic parents, missing fields). */
    INVALID_NODE_INPUT,

    /** A system tenant was targeted by a destructive operation. */
    PROTECTED_TENANT,

    /** The tenant is not known to the gateway or the backend. */
    TENANT_NOT_FOUND,

    /** Capability probing itself failed; the gateway runs on fail-closed OSS assumptions. */
    CAPABILITY_DETECTION_FAILED,

    /** Opaque wrapper around any storage or query failure. */
    BACKEND_ERROR;

    /**
     * Whether a caller may reasonably retry the same operation unchanged.
     * Capability mismatches and invariant violations never succeed on retry.
     */
    public boolean isTransient() {
        return switch (this) {
            case CAPABILITY_DETECTION_FAILED, BACKEND_ERROR -> true;
            case ENTERPRISE_FEATURE_NOT_AVAILABLE,
                    NAMESPACE_NOT_SUPPORTED,
                    INVALID_LEVEL,
                    NODE_TYPE_NOT_ALLOWED,
                    HIERARCHY_NOT_FOUND,
                    INVALID_NODE_INPUT,
                    PROTECTED_TENANT,
                    TENANT_NOT_FOUND -> false;
        };
    }
}
