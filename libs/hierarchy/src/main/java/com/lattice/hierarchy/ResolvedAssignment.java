package com.lattice.hierarchy;

/** Validated placement, ready to be persisted as a {@link HierarchyAssignment}. */
public record ResolvedAssignment(String hierarchyId, String levelId, int levelNumber) {}
