package com.lattice.gateway.health;

import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.CapabilitySummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * {@code capabilities} component of {@code /actuator/health}.
 *
 * <p>Always UP: a failed detection leaves the gateway serving in OSS mode, which is a degraded but
 * working state. The details say which mode and why.
 */
@Component("capabilities")
public class CapabilityHealthIndicator implements HealthIndicator {

    private final CapabilityCache capabilities;

    public CapabilityHealthIndicator(CapabilityCache capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    public Health health() {
        CapabilitySummary summary = capabilities.summary();
        Health.Builder builder = Health.up()
                .withDetail("state", summary.state().name())
                .withDetail("mode", summary.mode())
                .withDetail("namespacesSupported", summary.namespacesSupported())
                .withDetail("enterpriseDetected", summary.enterpriseDetected())
                .withDetail("licenseType", summary.licenseType());
        if (summary.detectedAt() != null) {
            builder.withDetail("detectedAt", summary.detectedAt().toString());
        }
        if (summary.error() != null) {
            builder.withDetail("error", summary.error());
        }
        return builder.build();
    }
}
