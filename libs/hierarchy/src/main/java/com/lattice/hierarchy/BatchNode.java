package com.lattice.hierarchy;

import com.lattice.common.LatticeException;
import java.util.List;
import java.util.Objects;

/**
 * One node of a batch creation with its requested hierarchy placements.
 */
public record BatchNode(NodeInput node, List<AssignmentRequest> assignments) {

    public BatchNode {
        if (assignments == null) {
            assignments = List.of();
        } else if (assignments.stream().anyMatch(Objects::isNull)) {
            throw LatticeException.invalidInput("resolveBatch",
                    "Node " + (node == null ? null : node.id()) + " has an empty assignment entry");
        } else {
            assignments = List.copyOf(assignments);
        }
    }
}
