package com.lattice.tenancy.capability;

/**
 * Read-only diagnostic calls against the graph backend.
 *
 * <p>Implementations throw an unchecked exception on transport failure (connection refused,
 * timeout, 5xx). Interpreting the answers is the probe's job.
 */
public interface BackendDiagnostics {

    /** Reads the backend health endpoint. */
    HealthReport health();

    /** Reads the license block of the cluster state. */
    LicenseReport license();

    /**
     * Attempts a read-only namespace-scoped operation.
     *
     * @param namespace namespace to address
     * @return true when the backend accepted or recognized the namespace parameter
     */
    boolean namespaceScopedOperationsWork(String namespace);
}
