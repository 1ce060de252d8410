package com.lattice.hierarchy;

import java.util.Optional;

/**
 * Read access to persisted hierarchies, used by {@link HierarchyValidator}.
 *
 * <p>Implementations throw an unchecked exception on backend failure.
 */
public interface HierarchyQuery {

    /** The hierarchy with all of its levels. */
    Optional<Hierarchy> findHierarchy(String hierarchyId);

    Optional<HierarchyLevel> findLevel(String levelId);

    /** The persisted assignment of {@code nodeId} in {@code hierarchyId}. */
    Optional<HierarchyAssignment> findAssignment(String nodeId, String hierarchyId);
}
