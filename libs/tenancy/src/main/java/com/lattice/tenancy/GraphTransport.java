package com.lattice.tenancy;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Sends one GraphQL operation to the graph backend.
 *
 * <p>Implementations throw {@link GraphQueryException} when the backend answers with GraphQL
 * errors, and any unchecked exception on transport failure.
 */
public interface GraphTransport {

    /**
     * @param namespace namespace to run in; null for the default namespace
     * @param query     GraphQL document
     * @param variables operation variables (may be empty)
     * @return the {@code data} member of the response
     */
    JsonNode execute(String namespace, String query, Map<String, Object> variables);
}
