package com.lattice.tenancy.capability;

import com.lattice.observability.SpanHelper;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies the backend from its health report, license block and a namespace-scoped probe.
 *
 * <p>Classification:
 *
 * <ol>
 *   <li>neither license metadata nor active enterprise features say enterprise: OSS, and the
 *       namespace-scoped call is never made;
 *   <li>enterprise evidence and the namespace-scoped call succeeds: namespaces supported;
 *   <li>enterprise evidence but the namespace-scoped call fails: enterprise without namespaces,
 *       logged at WARN;
 *   <li>any transport failure: OSS, with the failure kept in {@code error}.
 * </ol>
 */
public final class BackendCapabilityProbe implements CapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(BackendCapabilityProbe.class);

    private final BackendDiagnostics diagnostics;
    private final String probeNamespace;
    private final Clock clock;
    private final SpanHelper spanHelper;

    /**
     * @param diagnostics    read-only backend calls
     * @param probeNamespace namespace addressed by the namespace-scoped probe (the test namespace)
     * @param clock          source of {@code detectedAt}
     * @param spanHelper     tracing wrapper for the probe run
     */
    public BackendCapabilityProbe(BackendDiagnostics diagnostics, String probeNamespace, Clock clock,
                                  SpanHelper spanHelper) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("diagnostics must not be null");
        }
        if (probeNamespace == null || probeNamespace.isBlank()) {
            throw new IllegalArgumentException("probeNamespace must not be null or blank");
        }
        this.diagnostics = diagnostics;
        this.probeNamespace = probeNamespace;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.spanHelper = spanHelper == null ? SpanHelper.noop() : spanHelper;
    }

    @Override
    public TenantCapabilities detect() {
        return spanHelper.inSpan("capability.detect", this::classify);
    }

    private TenantCapabilities classify() {
        log.info("Detecting graph backend capabilities");
        try {
            HealthReport health = diagnostics.health();
            LicenseReport license = diagnostics.license();
            LicenseType licenseType = license.type();
            Instant detectedAt = clock.instant();

            if (!licenseType.isEnterprise() && !health.hasEnterpriseFeatures()) {
                log.info("No enterprise features detected (license={}); running in OSS mode", licenseType.wireName());
                return new TenantCapabilities(false, false, licenseType, license.expiry(), detectedAt, null);
            }

            if (diagnostics.namespaceScopedOperationsWork(probeNamespace)) {
                log.info("Namespace-scoped operations confirmed (license={}, version={})",
                        licenseType.wireName(), health.version());
                return new TenantCapabilities(true, true, licenseType, license.expiry(), detectedAt, null);
            }

            log.warn("Enterprise backend detected (license={}, features={}) but namespace check on {} failed;"
                            + " running single-tenant",
                    licenseType.wireName(), health.enterpriseFeatures(), probeNamespace);
            return new TenantCapabilities(true, false, licenseType, license.expiry(), detectedAt, null);
        } catch (RuntimeException e) {
            log.warn("Capability probe failed, assuming OSS single-tenant: {}", e.toString());
            return TenantCapabilities.failClosed(describe(e), clock.instant());
        }
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
