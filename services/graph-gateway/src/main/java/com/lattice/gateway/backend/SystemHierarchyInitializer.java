package com.lattice.gateway.backend;

import com.lattice.hierarchy.SystemHierarchy;
import com.lattice.tenancy.GraphTransport;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure the default namespace holds the {@link SystemHierarchy} ({@code h0}).
 *
 * <p>Checks for the hierarchy first and creates it only when absent. Backend failures are logged
 * and never propagate: a gateway without {@code h0} still starts.
 */
public class SystemHierarchyInitializer {

    private static final Logger log = LoggerFactory.getLogger(SystemHierarchyInitializer.class);

    private final GraphTransport transport;

    public SystemHierarchyInitializer(GraphTransport transport) {
        this.transport = transport;
    }

    /**
     * @return true when {@code h0} is present afterwards
     */
    public boolean initialize() {
        try {
            if (DgraphNamespaceProvisioner.hierarchyExists(transport, null, SystemHierarchy.ID)) {
                log.debug("System hierarchy {} already present in the default namespace", SystemHierarchy.ID);
                return true;
            }
            transport.execute(null, DgraphNamespaceProvisioner.ADD_HIERARCHY,
                    Map.of("hierarchy", DgraphNamespaceProvisioner.hierarchyInput(SystemHierarchy.create())));
            log.info("Created system hierarchy {} in the default namespace", SystemHierarchy.ID);
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not initialize system hierarchy {}: {}", SystemHierarchy.ID, e.toString());
            return false;
        }
    }
}
