package com.lattice.hierarchy;

import java.util.List;
import java.util.Set;

/**
 * Hierarchy seeded into every newly provisioned namespace.
 */
public final class DefaultHierarchy {

    public static final String ID = "default-hierarchy";
    public static final String NAME = "Default Hierarchy";

    private DefaultHierarchy() {
        // utility class
    }

    /**
     * Concepts (level 1, {@code concept}), Examples (level 2, {@code example}) and Details
     * (level 3, {@code question} and {@code note}).
     */
    public static Hierarchy create() {
        return new Hierarchy(ID, NAME, List.of(
                new HierarchyLevel(ID + "-l1", ID, 1, "Concepts", Set.of("concept")),
                new HierarchyLevel(ID + "-l2", ID, 2, "Examples", Set.of("example")),
                new HierarchyLevel(ID + "-l3", ID, 3, "Details", Set.of("question", "note"))));
    }
}
