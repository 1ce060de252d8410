package com.lattice.gateway.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.lattice.common.LatticeException;
import com.lattice.hierarchy.Hierarchy;
import com.lattice.hierarchy.HierarchyAssignment;
import com.lattice.hierarchy.HierarchyLevel;
import com.lattice.hierarchy.HierarchyQuery;
import com.lattice.tenancy.TenantClient;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link HierarchyQuery} reading hierarchies from the tenant's namespace through GraphQL.
 */
public class GraphqlHierarchyQuery implements HierarchyQuery {

    static final String GET_HIERARCHY = "query GetHierarchy($id: String!) { getHierarchy(id: $id) {"
            + " id name levels { id levelNumber label allowedTypes { typeName } } } }";

    static final String GET_LEVEL = "query GetLevel($id: ID!) { getHierarchyLevel(id: $id) {"
            + " id levelNumber label hierarchy { id } allowedTypes { typeName } } }";

    static final String GET_ASSIGNMENTS = "query ParentLevel($nodeId: String!) {"
            + " queryNode(filter: { id: { eq: $nodeId } }) {"
            + " hierarchyAssignments { id hierarchy { id } level { id } } } }";

    private final TenantClient client;

    public GraphqlHierarchyQuery(TenantClient client) {
        this.client = client;
    }

    @Override
    public Optional<Hierarchy> findHierarchy(String hierarchyId) {
        JsonNode hierarchy = client.execute(GET_HIERARCHY, Map.of("id", hierarchyId)).path("getHierarchy");
        if (absent(hierarchy)) {
            return Optional.empty();
        }
        String id = hierarchy.path("id").asText();
        List<HierarchyLevel> levels = new ArrayList<>();
        for (JsonNode level : hierarchy.path("levels")) {
            levels.add(toLevel(level, id));
        }
        try {
            return Optional.of(new Hierarchy(id, hierarchy.path("name").asText(id), levels));
        } catch (IllegalArgumentException e) {
            throw LatticeException.backend("findHierarchy",
                    "Backend returned an invalid hierarchy " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<HierarchyLevel> findLevel(String levelId) {
        JsonNode level = client.execute(GET_LEVEL, Map.of("id", levelId)).path("getHierarchyLevel");
        if (absent(level)) {
            return Optional.empty();
        }
        return Optional.of(toLevel(level, level.path("hierarchy").path("id").asText()));
    }

    @Override
    public Optional<HierarchyAssignment> findAssignment(String nodeId, String hierarchyId) {
        JsonNode nodes = client.execute(GET_ASSIGNMENTS, Map.of("nodeId", nodeId)).path("queryNode");
        for (JsonNode node : nodes) {
            for (JsonNode assignment : node.path("hierarchyAssignments")) {
                if (hierarchyId.equals(assignment.path("hierarchy").path("id").asText())) {
                    return Optional.of(new HierarchyAssignment(
                            assignment.path("id").asText(null),
                            nodeId,
                            hierarchyId,
                            assignment.path("level").path("id").asText()));
                }
            }
        }
        return Optional.empty();
    }

    private static HierarchyLevel toLevel(JsonNode level, String hierarchyId) {
        Set<String> allowedTypes = new HashSet<>();
        level.path("allowedTypes").forEach(type -> allowedTypes.add(type.path("typeName").asText()));
        try {
            return new HierarchyLevel(
                    level.path("id").asText(),
                    hierarchyId,
                    level.path("levelNumber").asInt(),
                    level.path("label").asText(""),
                    allowedTypes);
        } catch (IllegalArgumentException e) {
            throw LatticeException.backend("findLevel",
                    "Backend returned an invalid level in hierarchy " + hierarchyId + ": " + e.getMessage(), e);
        }
    }

    private static boolean absent(JsonNode node) {
        return node.isMissingNode() || node.isNull();
    }
}
