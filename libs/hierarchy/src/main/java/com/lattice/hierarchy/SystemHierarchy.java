package com.lattice.hierarchy;

import java.util.List;
import java.util.Set;

/**
 * The {@code h0} "None" hierarchy kept in the default namespace for uncategorized nodes.
 */
public final class SystemHierarchy {

    public static final String ID = "h0";
    public static final String NAME = "None";
    public static final String TYPE = "None";

    private SystemHierarchy() {
        // utility class
    }

    /** A single level, {@code Categories}, admitting only the {@code None} type. */
    public static Hierarchy create() {
        return new Hierarchy(ID, NAME, List.of(
                new HierarchyLevel(ID + "-l1", ID, 1, "Categories", Set.of(TYPE))));
    }
}
