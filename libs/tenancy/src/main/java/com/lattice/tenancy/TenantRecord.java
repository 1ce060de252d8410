package com.lattice.tenancy;

import java.time.Instant;

/**
 * A provisioned tenant.
 *
 * @param tenantId  tenant identifier
 * @param namespace namespace provisioned for it
 * @param createdAt when the gateway registered it
 */
public record TenantRecord(String tenantId, String namespace, Instant createdAt) {}
