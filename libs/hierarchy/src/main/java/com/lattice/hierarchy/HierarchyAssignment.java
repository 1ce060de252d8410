package com.lattice.hierarchy;

/**
 * Placement of a node at one level of one hierarchy. A node has at most one assignment per
 * hierarchy.
 */
public record HierarchyAssignment(String id, String nodeId, String hierarchyId, String levelId) {}
