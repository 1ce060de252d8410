package com.lattice.hierarchy;

import com.lattice.common.ErrorKind;
import com.lattice.common.LatticeError;
import com.lattice.common.LatticeException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the hierarchy level a new node is placed at, and checks the level admits the node's
 * type.
 *
 * <p>Level resolution for one placement:
 *
 * <ol>
 *   <li>an explicit level must exist and belong to the hierarchy;
 *   <li>otherwise, with a parent, the level numbered one below the parent's level in the same
 *       hierarchy;
 *   <li>otherwise level 1.
 * </ol>
 *
 * <p>Every failure is a {@link LatticeException}; nothing here writes to the backend.
 */
public final class HierarchyValidator {

    private static final Logger log = LoggerFactory.getLogger(HierarchyValidator.class);

    private final HierarchyQuery query;

    public HierarchyValidator(HierarchyQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        this.query = query;
    }

    /**
     * Resolves and validates one placement.
     *
     * @param node            node being created
     * @param hierarchyId     hierarchy to place it in
     * @param explicitLevelId requested level (nullable)
     * @param parentNodeId    persisted parent node (nullable, ignored when a level is given)
     * @return the id of the level to assign
     */
    public String resolveAndValidate(NodeInput node, String hierarchyId, String explicitLevelId, String parentNodeId) {
        String operation = "resolveAndValidate";
        validateNode(operation, node);
        Hierarchy hierarchy = loadHierarchy(operation, hierarchyId);
        return resolve(operation, node, hierarchy, explicitLevelId, parentNodeId, null).levelId();
    }

    /**
     * Resolves every placement of a batch, parents before children.
     *
     * <p>A placement whose parent is another node of the batch takes the parent's resolved level
     * number, so a not-yet-persisted parent is never looked up. The first invalid node fails the
     * whole batch.
     *
     * @return resolved nodes in dependency order (each in-batch parent precedes its children)
     */
    public List<ResolvedNode> resolveBatch(List<BatchNode> batch) {
        String operation = "resolveBatch";
        if (batch == null || batch.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> indexById = indexBatch(operation, batch);
        List<Integer> order = dependencyOrder(operation, batch, indexById);

        Map<String, Hierarchy> hierarchies = new HashMap<>();
        Map<String, Map<String, Integer>> resolvedLevels = new HashMap<>();
        List<ResolvedNode> resolved = new ArrayList<>(batch.size());
        for (int index : order) {
            NodeInput node = batch.get(index).node();
            List<ResolvedAssignment> assignments = new ArrayList<>();
            for (AssignmentRequest request : batch.get(index).assignments()) {
                Hierarchy hierarchy = hierarchies.get(request.hierarchyId());
                if (hierarchy == null) {
                    hierarchy = loadHierarchy(operation, request.hierarchyId());
                    hierarchies.put(hierarchy.id(), hierarchy);
                }
                Integer parentLevel = null;
                if (dependsOnBatch(request, indexById)) {
                    parentLevel = resolvedLevels.getOrDefault(request.parentId(), Map.of()).get(hierarchy.id());
                    if (parentLevel == null) {
                        throw invalidLevel(operation, "Parent node " + request.parentId()
                                + " in this batch has no assignment in hierarchy " + hierarchy.id(), hierarchy.id());
                    }
                }
                ResolvedAssignment assignment = resolve(
                        operation, node, hierarchy, request.levelId(), request.parentId(), parentLevel);
                assignments.add(assignment);
                if (node.id() != null) {
                    resolvedLevels.computeIfAbsent(node.id(), id -> new HashMap<>())
                            .put(hierarchy.id(), assignment.levelNumber());
                }
            }
            resolved.add(new ResolvedNode(node, List.copyOf(assignments)));
        }
        log.debug("Resolved hierarchy placements for {} nodes", resolved.size());
        return resolved;
    }

    private ResolvedAssignment resolve(String operation, NodeInput node, Hierarchy hierarchy,
                                       String explicitLevelId, String parentId, Integer knownParentLevel) {
        HierarchyLevel level;
        if (explicitLevelId != null) {
            level = explicitLevel(operation, hierarchy, explicitLevelId);
        } else if (parentId != null) {
            int parentLevel = knownParentLevel != null
                    ? knownParentLevel
                    : persistedParentLevel(operation, hierarchy, parentId);
            level = hierarchy.levelByNumber(parentLevel + 1).orElseThrow(() -> invalidLevel(operation,
                    "No level below level " + parentLevel + " in hierarchy " + hierarchy.id()
                            + " for child of " + parentId, hierarchy.id()));
        } else {
            level = hierarchy.levelByNumber(1).orElseThrow(() -> invalidLevel(operation,
                    "Hierarchy " + hierarchy.id() + " has no level 1", hierarchy.id()));
        }

        if (!level.allows(node.type())) {
            List<String> allowed = level.allowedTypes().stream().sorted().toList();
            throw new LatticeException(LatticeError.of(
                            ErrorKind.NODE_TYPE_NOT_ALLOWED,
                            operation,
                            "Node type '" + node.type() + "' is not allowed at level " + level.id()
                                    + " (allowed: " + String.join(", ", allowed) + ")",
                            "Use one of the allowed types or place the node at another level")
                    .with("type", node.type())
                    .with("levelId", level.id())
                    .with("allowedTypes", allowed));
        }
        log.debug("Node {} ({}) placed at level {} of hierarchy {}",
                node.id(), node.type(), level.levelNumber(), hierarchy.id());
        return new ResolvedAssignment(hierarchy.id(), level.id(), level.levelNumber());
    }

    private HierarchyLevel explicitLevel(String operation, Hierarchy hierarchy, String levelId) {
        HierarchyLevel level = hierarchy.level(levelId)
                .or(() -> query.findLevel(levelId))
                .orElseThrow(() -> invalidLevel(operation, "Level not found: " + levelId, hierarchy.id()));
        if (!level.hierarchyId().equals(hierarchy.id())) {
            throw invalidLevel(operation,
                    "Level " + levelId + " belongs to hierarchy " + level.hierarchyId() + ", not " + hierarchy.id(),
                    hierarchy.id());
        }
        return level;
    }

    private int persistedParentLevel(String operation, Hierarchy hierarchy, String parentId) {
        HierarchyAssignment assignment = query.findAssignment(parentId, hierarchy.id())
                .orElseThrow(() -> invalidLevel(operation,
                        "Parent node " + parentId + " has no assignment in hierarchy " + hierarchy.id(),
                        hierarchy.id()));
        return hierarchy.level(assignment.levelId())
                .or(() -> query.findLevel(assignment.levelId()))
                .map(HierarchyLevel::levelNumber)
                .orElseThrow(() -> invalidLevel(operation,
                        "Level " + assignment.levelId() + " of parent node " + parentId + " not found",
                        hierarchy.id()));
    }

    private Hierarchy loadHierarchy(String operation, String hierarchyId) {
        if (hierarchyId == null || hierarchyId.isBlank()) {
            throw LatticeException.invalidInput(operation, "A hierarchy id is required for node creation");
        }
        return query.findHierarchy(hierarchyId).orElseThrow(() -> new LatticeException(LatticeError.of(
                        ErrorKind.HIERARCHY_NOT_FOUND,
                        operation,
                        "Hierarchy not found: " + hierarchyId,
                        "Check the X-Hierarchy-Id header or the hierarchy id of the assignment")
                .with("hierarchyId", hierarchyId)));
    }

    private static Map<String, Integer> indexBatch(String operation, List<BatchNode> batch) {
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            BatchNode entry = batch.get(i);
            if (entry == null) {
                throw LatticeException.invalidInput(operation, "Batch entry " + i + " is null");
            }
            validateNode(operation, entry.node());
            String id = entry.node().id();
            if (id != null && indexById.putIfAbsent(id, i) != null) {
                throw LatticeException.invalidInput(operation, "Duplicate node id in batch: " + id);
            }
            if (entry.assignments().isEmpty()) {
                throw LatticeException.invalidInput(operation,
                        "Node " + describe(entry.node()) + " has no hierarchy assignment");
            }
            Set<String> hierarchyIds = new HashSet<>();
            for (AssignmentRequest request : entry.assignments()) {
                if (!hierarchyIds.add(request.hierarchyId())) {
                    throw LatticeException.invalidInput(operation, "Node " + describe(entry.node())
                            + " has more than one assignment in hierarchy " + request.hierarchyId());
                }
            }
        }
        return indexById;
    }

    /** Kahn's algorithm; ties keep input order. */
    private static List<Integer> dependencyOrder(String operation, List<BatchNode> batch,
                                                 Map<String, Integer> indexById) {
        int size = batch.size();
        List<Set<Integer>> children = new ArrayList<>(size);
        int[] pendingParents = new int[size];
        for (int i = 0; i < size; i++) {
            children.add(new LinkedHashSet<>());
        }
        for (int i = 0; i < size; i++) {
            Set<Integer> parents = new HashSet<>();
            for (AssignmentRequest request : batch.get(i).assignments()) {
                if (dependsOnBatch(request, indexById)) {
                    parents.add(indexById.get(request.parentId()));
                }
            }
            for (int parent : parents) {
                children.get(parent).add(i);
            }
            pendingParents[i] = parents.size();
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < size; i++) {
            if (pendingParents[i] == 0) {
                ready.add(i);
            }
        }
        List<Integer> order = new ArrayList<>(size);
        while (!ready.isEmpty()) {
            int next = ready.poll();
            order.add(next);
            for (int child : children.get(next)) {
                if (--pendingParents[child] == 0) {
                    ready.add(child);
                }
            }
        }
        if (order.size() < size) {
            List<String> cyclic = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                if (pendingParents[i] > 0) {
                    cyclic.add(describe(batch.get(i).node()));
                }
            }
            throw new LatticeException(LatticeError.of(
                            ErrorKind.INVALID_NODE_INPUT,
                            operation,
                            "Parent references in the batch form a cycle: " + String.join(", ", cyclic),
                            "Remove the circular parent references")
                    .with("nodes", cyclic));
        }
        return order;
    }

    private static boolean dependsOnBatch(AssignmentRequest request, Map<String, Integer> indexById) {
        return request.levelId() == null && request.parentId() != null && indexById.containsKey(request.parentId());
    }

    private static void validateNode(String operation, NodeInput node) {
        if (node == null) {
            throw LatticeException.invalidInput(operation, "Node input is required");
        }
        if (node.label() == null || node.label().isBlank()) {
            throw LatticeException.invalidInput(operation, "Node " + describe(node) + " has no label");
        }
        if (node.type() == null || node.type().isBlank()) {
            throw LatticeException.invalidInput(operation, "Node " + describe(node) + " has no type");
        }
    }

    private static String describe(NodeInput node) {
        return node.id() != null ? node.id() : "'" + node.label() + "'";
    }

    private static LatticeException invalidLevel(String operation, String details, String hierarchyId) {
        return new LatticeException(LatticeError.of(
                        ErrorKind.INVALID_LEVEL,
                        operation,
                        details,
                        "Check the level configuration of the hierarchy")
                .with("hierarchyId", hierarchyId));
    }
}
