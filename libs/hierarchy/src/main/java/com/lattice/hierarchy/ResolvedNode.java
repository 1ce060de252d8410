package com.lattice.hierarchy;

import java.util.List;

/** A batch node whose every placement has been validated. */
public record ResolvedNode(NodeInput node, List<ResolvedAssignment> assignments) {}
