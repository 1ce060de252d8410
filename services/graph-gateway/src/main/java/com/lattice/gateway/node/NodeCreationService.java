package com.lattice.gateway.node;

import com.lattice.common.LatticeException;
import com.lattice.gateway.web.TenantContextFilter;
import com.lattice.hierarchy.AssignmentRequest;
import com.lattice.hierarchy.BatchNode;
import com.lattice.hierarchy.HierarchyValidator;
import com.lattice.hierarchy.NodeInput;
import com.lattice.hierarchy.ResolvedAssignment;
import com.lattice.hierarchy.ResolvedNode;
import com.lattice.observability.MetricFactory;
import com.lattice.tenancy.AccessMode;
import com.lattice.tenancy.AdaptiveTenantClientFactory;
import com.lattice.tenancy.TenantClient;
import com.lattice.tenancy.TenantContext;
import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.TenantCapabilities;
import com.lattice.tenancy.guard.CapabilityGuards;
import com.lattice.tenancy.guard.GuardContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates a batch of nodes with validated hierarchy placements in one {@code addNode} mutation.
 *
 * <p>The whole batch is validated before anything is written. Nodes of a tenant other than the
 * default tenant are refused when the backend cannot isolate them in a namespace.
 */
@Service
public class NodeCreationService {

    private static final Logger log = LoggerFactory.getLogger(NodeCreationService.class);

    static final String OPERATION = "createNodes";
    static final String NODES_CREATED_METRIC = "lattice.nodes.created";

    static final String ADD_NODE = "mutation AddNode($input: [AddNodeInput!]!) { addNode(input: $input) {"
            + " node { id label type hierarchyAssignments { hierarchy { id } level { id levelNumber } } } } }";

    private final AdaptiveTenantClientFactory clients;
    private final CapabilityCache capabilities;
    private final MetricFactory metrics;

    public NodeCreationService(AdaptiveTenantClientFactory clients, CapabilityCache capabilities,
                               MetricFactory metrics) {
        this.clients = clients;
        this.capabilities = capabilities;
        this.metrics = metrics;
    }

    /**
     * Validates and creates {@code requests} for {@code tenantId}.
     *
     * @param hierarchyId hierarchy of every node without its own ({@code X-Hierarchy-Id})
     * @return the created nodes with their resolved placements, parents first
     * @throws LatticeException on any capability, validation or backend failure
     */
    public List<ResolvedNode> createNodes(String tenantId, String hierarchyId, List<NodeCreationRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw LatticeException.invalidInput(OPERATION, "At least one node is required");
        }
        TenantCapabilities caps = capabilities.ensureDetected();
        TenantContext context = clients.resolveContext(tenantId, AccessMode.WRITE);
        CapabilityGuards.validateTenantContext()
                .check(new GuardContext(OPERATION, caps, context.tenantId(), context.namespace()))
                .orThrow();

        TenantClient client = clients.clientFor(context);
        List<BatchNode> batch = new ArrayList<>(requests.size());
        for (NodeCreationRequest request : requests) {
            batch.add(toBatchNode(request, hierarchyId));
        }
        List<ResolvedNode> resolved = new HierarchyValidator(new GraphqlHierarchyQuery(client)).resolveBatch(batch);

        client.execute(ADD_NODE, Map.of("input", mutationInput(resolved)));
        metrics.tenantCounter(NODES_CREATED_METRIC, "Nodes created").increment(resolved.size());
        log.info("Created {} nodes for tenant {} in namespace {}",
                resolved.size(), context.tenantId(), context.namespaceLabel());
        return resolved;
    }

    private static BatchNode toBatchNode(NodeCreationRequest request, String headerHierarchyId) {
        if (request == null) {
            throw LatticeException.invalidInput(OPERATION, "Node entries must not be null");
        }
        NodeInput node = new NodeInput(request.id(), request.label(), request.type());
        if (request.assignments() != null && !request.assignments().isEmpty()) {
            return new BatchNode(node, request.assignments());
        }
        String hierarchyId = request.hierarchyId() != null ? request.hierarchyId() : headerHierarchyId;
        if (hierarchyId == null || hierarchyId.isBlank()) {
            throw LatticeException.invalidInput(OPERATION,
                    TenantContextFilter.HIERARCHY_HEADER + " header is required for node creation");
        }
        AssignmentRequest assignment = request.levelId() != null
                ? AssignmentRequest.atLevel(hierarchyId, request.levelId())
                : new AssignmentRequest(hierarchyId, null, request.parentId());
        return new BatchNode(node, List.of(assignment));
    }

    private static List<Map<String, Object>> mutationInput(List<ResolvedNode> resolved) {
        List<Map<String, Object>> input = new ArrayList<>(resolved.size());
        for (ResolvedNode node : resolved) {
            Map<String, Object> entry = new LinkedHashMap<>();
            if (node.node().id() != null) {
                entry.put("id", node.node().id());
            }
            entry.put("label", node.node().label());
            entry.put("type", node.node().type());
            List<Map<String, Object>> assignments = new ArrayList<>();
            for (ResolvedAssignment assignment : node.assignments()) {
                assignments.add(Map.of(
                        "hierarchy", Map.of("id", assignment.hierarchyId()),
                        "level", Map.of("id", assignment.levelId())));
            }
            entry.put("hierarchyAssignments", assignments);
            input.add(entry);
        }
        return input;
    }
}
