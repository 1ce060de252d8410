package com.lattice.gateway.node;

import com.lattice.hierarchy.AssignmentRequest;
import java.util.List;

/**
 * One node of a creation call.
 *
 * <p>Placement precedence: explicit {@code assignments}, then {@code levelId}, then
 * {@code parentId}, then the root level of the hierarchy.
 *
 * @param id          client-chosen node id (nullable)
 * @param label       display label
 * @param type        node type
 * @param hierarchyId overrides the call's hierarchy for this node (nullable)
 * @param levelId     explicit level (nullable)
 * @param parentId    parent node, persisted or earlier in the same call (nullable)
 * @param assignments explicit placements in one or more hierarchies (nullable)
 */
public record NodeCreationRequest(
        String id,
        String label,
        String type,
        String hierarchyId,
        String levelId,
        String parentId,
        List<AssignmentRequest> assignments) {

    public static NodeCreationRequest root(String id, String label, String type) {
        return new NodeCreationRequest(id, label, type, null, null, null, null);
    }

    public static NodeCreationRequest child(String id, String label, String type, String parentId) {
        return new NodeCreationRequest(id, label, type, null, null, parentId, null);
    }
}
