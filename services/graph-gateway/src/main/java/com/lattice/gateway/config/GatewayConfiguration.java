package com.lattice.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lattice.gateway.backend.DgraphNamespaceProvisioner;
import com.lattice.gateway.backend.HttpBackendDiagnostics;
import com.lattice.gateway.backend.HttpGraphTransport;
import com.lattice.gateway.backend.SystemHierarchyInitializer;
import com.lattice.observability.MetricFactory;
import com.lattice.observability.SpanHelper;
import com.lattice.tenancy.AdaptiveTenantClientFactory;
import com.lattice.tenancy.GraphTransport;
import com.lattice.tenancy.NamespaceIdGenerator;
import com.lattice.tenancy.NamespaceProvisioner;
import com.lattice.tenancy.NamespaceSettings;
import com.lattice.tenancy.TenantManager;
import com.lattice.tenancy.TenantRegistry;
import com.lattice.tenancy.capability.BackendCapabilityProbe;
import com.lattice.tenancy.capability.BackendDiagnostics;
import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.CapabilityProbe;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the tenancy and capability libraries to the HTTP backend adapters.
 */
@Configuration
public class GatewayConfiguration {

    static final String ADMIN_KEY_HEADER = "X-Admin-API-Key";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, GatewayProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper(GatewayProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("lattice-" + properties.name()));
    }

    @Bean
    public RestClient graphBackendClient(RestClient.Builder builder, GatewayProperties properties) {
        GatewayProperties.Backend backend = properties.backend();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(backend.timeout());
        requestFactory.setReadTimeout(backend.timeout());
        builder.baseUrl(backend.baseUrl()).requestFactory(requestFactory);
        if (backend.adminApiKey() != null && !backend.adminApiKey().isBlank()) {
            builder.defaultHeader(ADMIN_KEY_HEADER, backend.adminApiKey());
        }
        return builder.build();
    }

    @Bean
    public NamespaceSettings namespaceSettings(GatewayProperties properties) {
        return properties.namespaces().toSettings();
    }

    @Bean
    public BackendDiagnostics backendDiagnostics(RestClient graphBackendClient) {
        return new HttpBackendDiagnostics(graphBackendClient);
    }

    @Bean
    public CapabilityProbe capabilityProbe(BackendDiagnostics diagnostics, NamespaceSettings namespaces,
                                           Clock clock, SpanHelper spanHelper) {
        return new BackendCapabilityProbe(diagnostics, namespaces.testNamespace(), clock, spanHelper);
    }

    @Bean
    public CapabilityCache capabilityCache(CapabilityProbe probe, Clock clock, MetricFactory metrics) {
        return new CapabilityCache(probe, clock, metrics);
    }

    @Bean
    public GraphTransport graphTransport(RestClient graphBackendClient, ObjectMapper objectMapper) {
        return new HttpGraphTransport(graphBackendClient, objectMapper);
    }

    @Bean
    public NamespaceProvisioner namespaceProvisioner(
            RestClient graphBackendClient,
            GraphTransport transport,
            @Value("classpath:schemas/default.graphql") Resource schema) {
        return new DgraphNamespaceProvisioner(graphBackendClient, transport, read(schema));
    }

    @Bean
    public SystemHierarchyInitializer systemHierarchyInitializer(GraphTransport transport) {
        return new SystemHierarchyInitializer(transport);
    }

    @Bean
    public TenantRegistry tenantRegistry() {
        return new TenantRegistry();
    }

    @Bean
    public TenantManager tenantManager(CapabilityCache capabilities, NamespaceSettings namespaces,
                                       TenantRegistry registry, NamespaceProvisioner provisioner, Clock clock) {
        return new TenantManager(capabilities, new NamespaceIdGenerator(namespaces), registry, provisioner, clock);
    }

    @Bean
    public AdaptiveTenantClientFactory tenantClientFactory(
            CapabilityCache capabilities,
            TenantManager tenants,
            NamespaceSettings namespaces,
            GraphTransport transport,
            SpanHelper spanHelper) {
        return new AdaptiveTenantClientFactory(capabilities, tenants, namespaces, transport, spanHelper);
    }

    private static String read(Resource resource) {
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load default schema " + resource, e);
        }
    }
}
