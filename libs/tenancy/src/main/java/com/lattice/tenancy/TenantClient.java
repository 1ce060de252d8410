package com.lattice.tenancy;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;

/**
 * Graph client bound to one tenant's namespace.
 *
 * <p>Every failure surfaces as a {@link com.lattice.common.LatticeException}; transport exception
 * types never escape.
 */
public interface TenantClient {

    JsonNode execute(String query, Map<String, Object> variables);

    default JsonNode execute(String query) {
        return execute(query, Map.of());
    }

    String tenantId();

    /** Bound namespace; empty for the default namespace. */
    Optional<String> namespace();
}
