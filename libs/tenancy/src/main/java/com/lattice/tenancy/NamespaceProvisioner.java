package com.lattice.tenancy;

/**
 * Creates and removes tenant namespaces in the graph backend.
 *
 * <p>Implementations throw an unchecked exception on backend failure. {@link #provision} must be
 * idempotent: provisioning an existing namespace reports {@link ProvisionOutcome#ALREADY_EXISTS}.
 */
public interface NamespaceProvisioner {

    /** Installs the schema and seed data into {@code namespace}. */
    ProvisionOutcome provision(String namespace);

    /** Removes the tenant data held in {@code namespace}. */
    void deprovision(String namespace);

    /** Whether {@code namespace} answers a trivial query. */
    boolean isAccessible(String namespace);
}
