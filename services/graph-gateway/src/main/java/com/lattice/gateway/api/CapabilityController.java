package com.lattice.gateway.api;

import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.CapabilitySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Capability summary of the graph backend, and the re-detection escape hatch.
 */
@RestController
@RequestMapping("/api/v1/capabilities")
public class CapabilityController {

    private static final Logger log = LoggerFactory.getLogger(CapabilityController.class);

    private final CapabilityCache capabilities;

    public CapabilityController(CapabilityCache capabilities) {
        this.capabilities = capabilities;
    }

    @GetMapping
    public CapabilitySummary summary() {
        capabilities.ensureDetected();
        return capabilities.summary();
    }

    /** Re-runs detection, for instance after the backend license changed. */
    @PostMapping("/refresh")
    public CapabilitySummary refresh() {
        log.info("Capability refresh requested");
        capabilities.reinitialize();
        return capabilities.summary();
    }
}
