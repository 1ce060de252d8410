package com.lattice.hierarchy;

import java.util.Set;

/**
 * One level of a {@link Hierarchy}.
 *
 * @param id           level id
 * @param hierarchyId  owning hierarchy
 * @param levelNumber  position in the hierarchy, positive
 * @param label        display label
 * @param allowedTypes node types that may be assigned to this level; empty admits every type
 */
public record HierarchyLevel(
        String id,
        String hierarchyId,
        int levelNumber,
        String label,
        Set<String> allowedTypes
) {

    public HierarchyLevel {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (hierarchyId == null || hierarchyId.isBlank()) {
            throw new IllegalArgumentException("hierarchyId must not be null or blank");
        }
        if (levelNumber < 1) {
            throw new IllegalArgumentException("levelNumber must be positive, was " + levelNumber);
        }
        allowedTypes = allowedTypes == null ? Set.of() : Set.copyOf(allowedTypes);
    }

    public boolean allows(String type) {
        return allowedTypes.isEmpty() || allowedTypes.contains(type);
    }
}
