package com.lattice.tenancy.capability;

import static org.assertj.core.api.Assertions.assertThat;

import com.lattice.tenancy.testing.StubBackendDiagnostics;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BackendCapabilityProbe")
class BackendCapabilityProbeTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static TenantCapabilities detect(StubBackendDiagnostics diagnostics) {
        return new BackendCapabilityProbe(diagnostics, "0x1", CLOCK, null).detect();
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("working namespace probe means multi-tenant enterprise")
        void namespacesSupported() {
            TenantCapabilities caps = detect(StubBackendDiagnostics.enterpriseWithNamespaces());

            assertThat(caps.namespacesSupported()).isTrue();
            assertThat(caps.enterpriseDetected()).isTrue();
            assertThat(caps.licenseType()).isEqualTo(LicenseType.ENTERPRISE_LICENSED);
            assertThat(caps.licenseExpiry()).isEqualTo(Instant.parse("2030-01-01T00:00:00Z"));
            assertThat(caps.mode()).isEqualTo(DeploymentMode.ENTERPRISE_MULTI_TENANT);
            assertThat(caps.detectedAt()).isEqualTo(NOW);
            assertThat(caps.failed()).isFalse();
        }

        @Test
        @DisplayName("namespace answer is ignored without license metadata or enterprise features")
        void namespacesNeedEnterpriseEvidence() {
            StubBackendDiagnostics diagnostics = StubBackendDiagnostics.oss().withNamespaces(true);

            TenantCapabilities caps = detect(diagnostics);

            assertThat(caps.namespacesSupported()).isFalse();
            assertThat(caps.enterpriseDetected()).isFalse();
            assertThat(caps.mode()).isEqualTo(DeploymentMode.OSS_SINGLE_TENANT);
            assertThat(diagnostics.namespaceCheckCount()).isZero();
        }

        @Test
        @DisplayName("enterprise features with a working namespace call are multi-tenant without a license")
        void featuresAndNamespaces() {
            StubBackendDiagnostics diagnostics = StubBackendDiagnostics.oss()
                    .withHealth(new HealthReport("v23", List.of("multi_tenancy"), true))
                    .withNamespaces(true);

            TenantCapabilities caps = detect(diagnostics);

            assertThat(caps.mode()).isEqualTo(DeploymentMode.ENTERPRISE_MULTI_TENANT);
            assertThat(caps.licenseType()).isEqualTo(LicenseType.OSS_ONLY);
            assertThat(diagnostics.namespaceCheckCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("enterprise license without working namespaces stays a distinct mode")
        void enterpriseWithoutNamespaces() {
            TenantCapabilities caps = detect(StubBackendDiagnostics.enterpriseWithoutNamespaces());

            assertThat(caps.enterpriseDetected()).isTrue();
            assertThat(caps.namespacesSupported()).isFalse();
            assertThat(caps.mode()).isEqualTo(DeploymentMode.ENTERPRISE_SINGLE_TENANT);
        }

        @Test
        @DisplayName("active enterprise features alone count as enterprise")
        void enterpriseFeatures() {
            TenantCapabilities caps = detect(StubBackendDiagnostics.oss()
                    .withHealth(new HealthReport("v23", List.of("backup_restore"), false)));

            assertThat(caps.enterpriseDetected()).isTrue();
            assertThat(caps.licenseType()).isEqualTo(LicenseType.OSS_ONLY);
        }

        @Test
        @DisplayName("trial license counts as enterprise")
        void trialLicense() {
            TenantCapabilities caps = detect(StubBackendDiagnostics.oss()
                    .withLicense(new LicenseReport(true, true, "", null)));

            assertThat(caps.licenseType()).isEqualTo(LicenseType.OSS_TRIAL);
            assertThat(caps.enterpriseDetected()).isTrue();
        }

        @Test
        @DisplayName("plain OSS backend")
        void oss() {
            TenantCapabilities caps = detect(StubBackendDiagnostics.oss());

            assertThat(caps.enterpriseDetected()).isFalse();
            assertThat(caps.namespacesSupported()).isFalse();
            assertThat(caps.licenseType()).isEqualTo(LicenseType.OSS_ONLY);
            assertThat(caps.mode()).isEqualTo(DeploymentMode.OSS_SINGLE_TENANT);
            assertThat(caps.error()).isNull();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("unreachable backend fails closed with the error kept")
        void unreachable() {
            TenantCapabilities caps = detect(StubBackendDiagnostics.unreachable(
                    new IllegalStateException("Connection refused")));

            assertThat(caps.enterpriseDetected()).isFalse();
            assertThat(caps.namespacesSupported()).isFalse();
            assertThat(caps.licenseType()).isEqualTo(LicenseType.UNKNOWN);
            assertThat(caps.error()).isEqualTo("Connection refused");
            assertThat(caps.failed()).isTrue();
        }

        @Test
        @DisplayName("exception without message is described by its type")
        void messageless() {
            TenantCapabilities caps = detect(StubBackendDiagnostics.unreachable(new IllegalStateException()));

            assertThat(caps.error()).isEqualTo("IllegalStateException");
        }
    }

    @Nested
    @DisplayName("LicenseReport")
    class Licenses {

        @Test
        @DisplayName("absent or disabled license is OSS only")
        void ossOnly() {
            assertThat(LicenseReport.absent().type()).isEqualTo(LicenseType.OSS_ONLY);
            assertThat(new LicenseReport(true, false, "acme", null).type()).isEqualTo(LicenseType.OSS_ONLY);
        }

        @Test
        @DisplayName("enabled license with a licensee is enterprise")
        void licensed() {
            assertThat(new LicenseReport(true, true, "acme", null).type())
                    .isEqualTo(LicenseType.ENTERPRISE_LICENSED);
        }
    }
}
