package com.lattice.gateway.config;

import com.lattice.tenancy.NamespaceSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway configuration, bound from {@code lattice.gateway.*}:
 *
 * <pre>
 * lattice:
 *   gateway:
 *     name: graph-gateway
 *     environment: production
 *     detect-on-startup: true
 *     backend:
 *       base-url: http://dgraph-alpha:8080
 *       admin-api-key: ${ADMIN_API_KEY:}
 *       timeout: 5s
 *     namespaces:
 *       default-namespace: 0x0
 *       test-namespace: 0x1
 *       prefix: 0x
 * </pre>
 *
 * @param name            service name used for logging and metrics. Required.
 * @param environment     deployment environment
 * @param detectOnStartup run capability detection once the application is ready
 * @param backend         graph backend connection
 * @param namespaces      reserved namespace ids
 */
@ConfigurationProperties(prefix = "lattice.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String name,
        String environment,
        Boolean detectOnStartup,
        @Valid Backend backend,
        @Valid Namespaces namespaces) {

    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (detectOnStartup == null) {
            detectOnStartup = Boolean.TRUE;
        }
        if (backend == null) {
            backend = new Backend(null, null, null);
        }
        if (namespaces == null) {
            namespaces = new Namespaces(null, null, null);
        }
    }

    /**
     * @param baseUrl     backend HTTP endpoint
     * @param adminApiKey sent as {@code X-Admin-API-Key} when set
     * @param timeout     connect and read timeout for backend calls
     */
    public record Backend(@NotBlank String baseUrl, String adminApiKey, Duration timeout) {

        public Backend {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "http://localhost:8080";
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                timeout = Duration.ofSeconds(5);
            }
        }
    }

    public record Namespaces(String defaultNamespace, String testNamespace, String prefix) {

        public NamespaceSettings toSettings() {
            return new NamespaceSettings(defaultNamespace, testNamespace, prefix);
        }
    }
}
