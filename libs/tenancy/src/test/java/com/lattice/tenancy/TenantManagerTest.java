package com.lattice.tenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lattice.common.ErrorKind;
import com.lattice.common.LatticeException;
import com.lattice.observability.MetricFactory;
import com.lattice.tenancy.capability.BackendCapabilityProbe;
import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.testing.InMemoryNamespaceProvisioner;
import com.lattice.tenancy.testing.StubBackendDiagnostics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TenantManager")
class TenantManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final NamespaceIdGenerator ids = new NamespaceIdGenerator(NamespaceSettings.defaults());
    private final TenantRegistry registry = new TenantRegistry();
    private final InMemoryNamespaceProvisioner provisioner = new InMemoryNamespaceProvisioner();

    private TenantManager managerFor(StubBackendDiagnostics diagnostics) {
        CapabilityCache cache = new CapabilityCache(
                new BackendCapabilityProbe(diagnostics, "0x1", CLOCK, null),
                CLOCK,
                new MetricFactory(new SimpleMeterRegistry(), "graph-gateway"));
        return new TenantManager(cache, ids, registry, provisioner, CLOCK);
    }

    private static ErrorKind kindOf(Throwable e) {
        return ((LatticeException) e).kind();
    }

    @Nested
    @DisplayName("createTenant()")
    class CreateTenant {

        @Test
        @DisplayName("provisions the derived namespace and registers the tenant")
        void provisions() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            String namespace = manager.createTenant("acme");

            assertThat(namespace).isEqualTo(ids.namespaceFor("acme"));
            assertThat(provisioner.contains(namespace)).isTrue();
            assertThat(registry.find("acme")).isPresent();
            assertThat(manager.tenantExists("acme")).isTrue();
        }

        @Test
        @DisplayName("is idempotent")
        void idempotent() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            String first = manager.createTenant("acme");
            String second = manager.createTenant("acme");

            assertThat(second).isEqualTo(first);
            assertThat(provisioner.provisionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("treats an existing namespace as success")
        void alreadyExists() {
            provisioner.withExisting(ids.namespaceFor("acme"));
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThat(manager.createTenant("acme")).isEqualTo(ids.namespaceFor("acme"));
        }

        @Test
        @DisplayName("fails with NAMESPACE_NOT_SUPPORTED on OSS")
        void ossRejected() {
            TenantManager manager = managerFor(StubBackendDiagnostics.oss());

            assertThatThrownBy(() -> manager.createTenant("acme"))
                    .isInstanceOf(LatticeException.class)
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.NAMESPACE_NOT_SUPPORTED));
            assertThat(provisioner.provisionCount()).isZero();
        }

        @Test
        @DisplayName("fails with NAMESPACE_NOT_SUPPORTED when enterprise lacks namespaces")
        void enterpriseSingleTenantRejected() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithoutNamespaces());

            assertThatThrownBy(() -> manager.createTenant("acme"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.NAMESPACE_NOT_SUPPORTED));
        }

        @ParameterizedTest
        @ValueSource(strings = {"ab", "-acme", "acme corp", "a/b"})
        @DisplayName("rejects malformed tenant ids")
        void rejectsMalformed(String tenantId) {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThatThrownBy(() -> manager.createTenant(tenantId))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.INVALID_NODE_INPUT));
        }

        @Test
        @DisplayName("wraps provisioning failures as BACKEND_ERROR and registers nothing")
        void backendFailure() {
            provisioner.failingWith(new IllegalStateException("schema push rejected"));
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThatThrownBy(() -> manager.createTenant("acme"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.BACKEND_ERROR))
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(registry.find("acme")).isEmpty();
        }

        @Test
        @DisplayName("concurrent creation of one tenant provisions once and lists it once")
        void concurrentCreation() throws Exception {
            provisioner.withDelay(50);
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return manager.createTenant("acme");
                    }));
                }
                start.countDown();

                for (Future<String> result : results) {
                    assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(ids.namespaceFor("acme"));
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(provisioner.provisionCount()).isEqualTo(1);
            assertThat(manager.listTenants())
                    .filteredOn(info -> info.tenantId().equals("acme"))
                    .hasSize(1);
        }
    }

    @Nested
    @DisplayName("deleteTenant()")
    class DeleteTenant {

        @ParameterizedTest
        @ValueSource(strings = {"default", "test-tenant"})
        @DisplayName("system tenants can never be deleted, whatever the capabilities")
        void protectedTenants(String tenantId) {
            for (StubBackendDiagnostics diagnostics : List.of(
                    StubBackendDiagnostics.oss(),
                    StubBackendDiagnostics.enterpriseWithNamespaces(),
                    StubBackendDiagnostics.unreachable(new IllegalStateException("down")))) {
                TenantManager manager = managerFor(diagnostics);

                assertThatThrownBy(() -> manager.deleteTenant(tenantId))
                        .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.PROTECTED_TENANT));
            }
        }

        @Test
        @DisplayName("unknown tenant fails with TENANT_NOT_FOUND")
        void unknown() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThatThrownBy(() -> manager.deleteTenant("ghost"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.TENANT_NOT_FOUND));
        }

        @Test
        @DisplayName("OSS backend fails with NAMESPACE_NOT_SUPPORTED")
        void oss() {
            TenantManager manager = managerFor(StubBackendDiagnostics.oss());

            assertThatThrownBy(() -> manager.deleteTenant("acme"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.NAMESPACE_NOT_SUPPORTED));
        }

        @Test
        @DisplayName("deprovisions and unregisters a known tenant")
        void deletes() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());
            String namespace = manager.createTenant("acme");

            manager.deleteTenant("acme");

            assertThat(provisioner.contains(namespace)).isFalse();
            assertThat(registry.find("acme")).isEmpty();
            assertThat(manager.tenantExists("acme")).isFalse();
        }
    }

    @Nested
    @DisplayName("getTenantNamespace()")
    class GetTenantNamespace {

        @Test
        @DisplayName("default tenant uses the default namespace")
        void defaultTenant() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThat(manager.getTenantNamespace("default")).isEmpty();
        }

        @Test
        @DisplayName("test tenant gets the fixed test namespace")
        void testTenant() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThat(manager.getTenantNamespace("test-tenant")).contains("0x1");
        }

        @Test
        @DisplayName("unknown tenant is created on first use")
        void lazyCreation() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThat(manager.getTenantNamespace("acme")).contains(ids.namespaceFor("acme"));
            assertThat(provisioner.provisionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("without namespace support every tenant uses the default namespace")
        void oss() {
            TenantManager manager = managerFor(StubBackendDiagnostics.oss());

            assertThat(manager.getTenantNamespace("acme")).isEmpty();
            assertThat(manager.getTenantNamespace("test-tenant")).isEmpty();
            assertThat(provisioner.provisionCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("resolveNamespace is stable across manager instances")
        void stableResolution() {
            TenantManager first = managerFor(StubBackendDiagnostics.oss());
            TenantManager second = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThat(first.resolveNamespace("acme")).isEqualTo(second.resolveNamespace("acme"));
        }

        @Test
        @DisplayName("tenant provisioned by an earlier process is rediscovered")
        void rediscovered() {
            provisioner.withExisting(ids.namespaceFor("acme"));
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThat(manager.tenantExists("acme")).isTrue();
            assertThat(registry.find("acme")).isPresent();
        }

        @Test
        @DisplayName("listTenants starts with the system tenants")
        void listsSystemTenants() {
            TenantManager manager = managerFor(StubBackendDiagnostics.oss());

            List<TenantInfo> tenants = manager.listTenants();

            assertThat(tenants).extracting(TenantInfo::tenantId).containsExactly("default", "test-tenant");
            assertThat(tenants).allSatisfy(info -> {
                assertThat(info.namespace()).isEqualTo("0x0");
                assertThat(info.mode()).isEqualTo("oss-single-tenant");
            });
        }

        @Test
        @DisplayName("getTenantInfo reports health of the namespace")
        void info() {
            TenantManager manager = managerFor(StubBackendDiagnostics.enterpriseWithNamespaces());
            manager.createTenant("acme");

            TenantInfo info = manager.getTenantInfo("acme");

            assertThat(info.exists()).isTrue();
            assertThat(info.health()).isEqualTo(TenantHealth.HEALTHY);
            assertThat(info.namespace()).isEqualTo(ids.namespaceFor("acme"));
            assertThat(manager.getTenantInfo("ghost").health()).isEqualTo(TenantHealth.UNKNOWN);
        }
    }
}
