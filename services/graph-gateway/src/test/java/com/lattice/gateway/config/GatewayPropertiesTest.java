package com.lattice.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lattice.tenancy.NamespaceSettings;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GatewayProperties")
class GatewayPropertiesTest {

    @Test
    @DisplayName("accepts fully specified properties")
    void acceptsValidProperties() {
        var props = new GatewayProperties("graph-gateway", "production", false,
                new GatewayProperties.Backend("http://dgraph-alpha:8080", "secret", Duration.ofSeconds(2)),
                new GatewayProperties.Namespaces("0x0", "0x1", "0x"));

        assertThat(props.name()).isEqualTo("graph-gateway");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.detectOnStartup()).isFalse();
        assertThat(props.backend().baseUrl()).isEqualTo("http://dgraph-alpha:8080");
        assertThat(props.backend().adminApiKey()).isEqualTo("secret");
        assertThat(props.backend().timeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("defaults environment, startup detection and nested sections")
    void defaultsWhenOmitted() {
        var props = new GatewayProperties("graph-gateway", null, null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.detectOnStartup()).isTrue();
        assertThat(props.backend().baseUrl()).isEqualTo("http://localhost:8080");
        assertThat(props.backend().timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.namespaces().toSettings()).isEqualTo(NamespaceSettings.defaults());
    }

    @Test
    @DisplayName("replaces a zero or negative timeout with the default")
    void defaultsNonPositiveTimeout() {
        assertThat(new GatewayProperties.Backend(null, null, Duration.ZERO).timeout())
                .isEqualTo(Duration.ofSeconds(5));
        assertThat(new GatewayProperties.Backend(null, null, Duration.ofSeconds(-1)).timeout())
                .isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("custom namespace ids flow into the namespace settings")
    void customNamespaces() {
        NamespaceSettings settings = new GatewayProperties.Namespaces("0x0", "0x7", "ns-").toSettings();

        assertThat(settings.testNamespace()).isEqualTo("0x7");
        assertThat(settings.prefix()).isEqualTo("ns-");
    }

    @Test
    @DisplayName("rejects a test namespace equal to the default namespace")
    void rejectsCollidingNamespaces() {
        assertThatThrownBy(() -> new GatewayProperties.Namespaces("0x0", "0x0", "0x").toSettings())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
