package com.lattice.tenancy;

/** What {@link NamespaceProvisioner#provision(String)} found. Both outcomes are success. */
public enum ProvisionOutcome {
    CREATED,
    ALREADY_EXISTS
}
