package com.lattice.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.lattice.hierarchy.DefaultHierarchy;
import com.lattice.hierarchy.Hierarchy;
import com.lattice.tenancy.GraphQueryException;
import com.lattice.tenancy.GraphTransport;
import com.lattice.tenancy.NamespaceProvisioner;
import com.lattice.tenancy.ProvisionOutcome;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Provisions a namespace by pushing the default GraphQL schema to
 * {@code /admin/schema?namespace=} and seeding {@link DefaultHierarchy}.
 *
 * <p>A namespace that already holds the default hierarchy is left untouched.
 */
public class DgraphNamespaceProvisioner implements NamespaceProvisioner {

    private static final Logger log = LoggerFactory.getLogger(DgraphNamespaceProvisioner.class);

    static final String PROBE_QUERY = "query { __schema { queryType { name } } }";

    static final String FIND_HIERARCHY =
            "query FindHierarchy($id: String!) { getHierarchy(id: $id) { id } }";

    static final String ADD_HIERARCHY =
            "mutation CreateHierarchy($hierarchy: AddHierarchyInput!) {"
                    + " addHierarchy(input: [$hierarchy]) {"
                    + " hierarchy { id name levels { id levelNumber label } } } }";

    static final String DROP_DATA = "mutation {"
            + " deleteNode(filter: {}) { numUids }"
            + " deleteHierarchy(filter: {}) { numUids }"
            + " deleteEdge(filter: {}) { numUids } }";

    private final RestClient client;
    private final GraphTransport transport;
    private final String schema;

    public DgraphNamespaceProvisioner(RestClient client, GraphTransport transport, String schema) {
        if (schema == null || schema.isBlank()) {
            throw new IllegalArgumentException("schema must not be blank");
        }
        this.client = client;
        this.transport = transport;
        this.schema = schema;
    }

    @Override
    public ProvisionOutcome provision(String namespace) {
        if (isAccessible(namespace) && hasDefaultHierarchy(namespace)) {
            log.info("Namespace {} already provisioned", namespace);
            return ProvisionOutcome.ALREADY_EXISTS;
        }
        pushSchema(namespace);
        seed(namespace, DefaultHierarchy.create());
        log.info("Provisioned namespace {}", namespace);
        return ProvisionOutcome.CREATED;
    }

    @Override
    public void deprovision(String namespace) {
        transport.execute(namespace, DROP_DATA, Map.of());
        log.info("Dropped tenant data in namespace {}", namespace);
    }

    @Override
    public boolean isAccessible(String namespace) {
        try {
            transport.execute(namespace, PROBE_QUERY, Map.of());
            return true;
        } catch (GraphQueryException | RestClientResponseException e) {
            log.debug("Namespace {} not accessible: {}", namespace, e.getMessage());
            return false;
        }
    }

    private boolean hasDefaultHierarchy(String namespace) {
        try {
            return hierarchyExists(transport, namespace, DefaultHierarchy.ID);
        } catch (GraphQueryException e) {
            // schema without the Hierarchy type
            return false;
        }
    }

    static boolean hierarchyExists(GraphTransport transport, String namespace, String hierarchyId) {
        JsonNode found = transport.execute(namespace, FIND_HIERARCHY, Map.of("id", hierarchyId)).path("getHierarchy");
        return !found.isMissingNode() && !found.isNull();
    }

    private void pushSchema(String namespace) {
        JsonNode response = client.post()
                .uri("/admin/schema?namespace={namespace}", namespace)
                .contentType(MediaType.valueOf("application/graphql"))
                .body(schema)
                .retrieve()
                .body(JsonNode.class);
        JsonNode errors = response == null ? null : response.path("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            throw new GraphQueryException(List.of("schema push rejected: " + errors));
        }
    }

    private void seed(String namespace, Hierarchy hierarchy) {
        transport.execute(namespace, ADD_HIERARCHY, Map.of("hierarchy", hierarchyInput(hierarchy)));
    }

    static Map<String, Object> hierarchyInput(Hierarchy hierarchy) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("id", hierarchy.id());
        input.put("name", hierarchy.name());
        input.put("levels", hierarchy.levels().stream()
                .map(level -> Map.of(
                        "levelNumber", level.levelNumber(),
                        "label", level.label(),
                        "allowedTypes", level.allowedTypes().stream()
                                .sorted()
                                .map(type -> Map.of("typeName", type))
                                .toList()))
                .toList());
        return input;
    }
}
