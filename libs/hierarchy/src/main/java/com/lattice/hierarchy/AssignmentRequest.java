package com.lattice.hierarchy;

/**
 * Requested placement of a batch node in one hierarchy.
 *
 * @param hierarchyId target hierarchy
 * @param levelId     explicit level (nullable)
 * @param parentId    parent node, persisted or in the same batch (nullable)
 */
public record AssignmentRequest(String hierarchyId, String levelId, String parentId) {

    public static AssignmentRequest root(String hierarchyId) {
        return new AssignmentRequest(hierarchyId, null, null);
    }

    public static AssignmentRequest atLevel(String hierarchyId, String levelId) {
        return new AssignmentRequest(hierarchyId, levelId, null);
    }

    public static AssignmentRequest under(String hierarchyId, String parentId) {
        return new AssignmentRequest(hierarchyId, null, parentId);
    }
}
