package com.lattice.gateway;

import com.lattice.gateway.config.GatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Lattice graph gateway: tenant-aware, capability-adaptive front for the graph backend.
 *
 * <ul>
 *   <li>capability detection at startup, memoized for the process lifetime
 *   <li>tenant context resolution from {@code X-Tenant-Id}
 *   <li>capability response headers on every response
 *   <li>structured error handling (RFC 7807 ProblemDetail)
 *   <li>Actuator health with a {@code capabilities} component
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class GraphGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphGatewayApplication.class, args);
    }
}
