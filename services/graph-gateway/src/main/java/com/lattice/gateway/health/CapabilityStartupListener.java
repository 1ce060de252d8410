package com.lattice.gateway.health;

import com.lattice.gateway.backend.SystemHierarchyInitializer;
import com.lattice.gateway.config.GatewayProperties;
import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.TenantCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs capability detection once the application is ready, so the first request does not pay for
 * it, then makes sure the default namespace holds the system hierarchy. Detection is deferred with
 * {@code lattice.gateway.detect-on-startup=false}; the system hierarchy is checked either way.
 */
@Component
public class CapabilityStartupListener {

    private static final Logger log = LoggerFactory.getLogger(CapabilityStartupListener.class);

    private final CapabilityCache capabilities;
    private final GatewayProperties properties;
    private final SystemHierarchyInitializer systemHierarchy;

    public CapabilityStartupListener(CapabilityCache capabilities, GatewayProperties properties,
                                     SystemHierarchyInitializer systemHierarchy) {
        this.capabilities = capabilities;
        this.properties = properties;
        this.systemHierarchy = systemHierarchy;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        detectCapabilities();
        systemHierarchy.initialize();
    }

    void detectCapabilities() {
        if (!properties.detectOnStartup()) {
            log.info("Capability detection deferred to first use");
            return;
        }
        TenantCapabilities caps = capabilities.ensureDetected();
        if (caps.failed()) {
            log.warn("{} started in {} mode; capability detection failed: {}",
                    properties.name(), caps.mode().wireName(), caps.error());
        } else {
            log.info("{} started in {} mode (license {})",
                    properties.name(), caps.mode().wireName(), caps.licenseType().wireName());
        }
    }
}
