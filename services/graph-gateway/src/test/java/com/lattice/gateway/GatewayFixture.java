package com.lattice.gateway;

import com.lattice.observability.MetricFactory;
import com.lattice.observability.SpanHelper;
import com.lattice.tenancy.AdaptiveTenantClientFactory;
import com.lattice.tenancy.NamespaceIdGenerator;
import com.lattice.tenancy.NamespaceSettings;
import com.lattice.tenancy.TenantManager;
import com.lattice.tenancy.TenantRegistry;
import com.lattice.tenancy.capability.BackendCapabilityProbe;
import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.testing.InMemoryNamespaceProvisioner;
import com.lattice.tenancy.testing.RecordingGraphTransport;
import com.lattice.tenancy.testing.StubBackendDiagnostics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;

/**
 * The gateway's tenancy wiring over in-memory backends, for tests that need real collaborators
 * without a Spring context.
 */
public final class GatewayFixture {

    public final NamespaceSettings settings = NamespaceSettings.defaults();
    public final NamespaceIdGenerator ids = new NamespaceIdGenerator(settings);
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final MetricFactory metrics = new MetricFactory(registry, "graph-gateway-test");
    public final InMemoryNamespaceProvisioner provisioner = new InMemoryNamespaceProvisioner();
    public final RecordingGraphTransport transport = new RecordingGraphTransport();
    public final StubBackendDiagnostics diagnostics;
    public final CapabilityCache capabilities;
    public final TenantManager tenants;
    public final AdaptiveTenantClientFactory clients;

    private GatewayFixture(StubBackendDiagnostics diagnostics) {
        Clock clock = Clock.systemUTC();
        this.diagnostics = diagnostics;
        this.capabilities = new CapabilityCache(
                new BackendCapabilityProbe(diagnostics, settings.testNamespace(), clock, SpanHelper.noop()),
                clock,
                metrics);
        this.tenants = new TenantManager(capabilities, ids, new TenantRegistry(), provisioner, clock);
        this.clients = new AdaptiveTenantClientFactory(
                capabilities, tenants, settings, transport, SpanHelper.noop());
    }

    public static GatewayFixture oss() {
        return new GatewayFixture(StubBackendDiagnostics.oss());
    }

    public static GatewayFixture enterprise() {
        return new GatewayFixture(StubBackendDiagnostics.enterpriseWithNamespaces());
    }

    public static GatewayFixture with(StubBackendDiagnostics diagnostics) {
        return new GatewayFixture(diagnostics);
    }
}
