package com.lattice.gateway.config;

import com.lattice.gateway.web.CapabilityHeadersFilter;
import com.lattice.gateway.web.CorrelationIdFilter;
import com.lattice.gateway.web.TenantContextFilter;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the local frontends. Browsers may only read the capability headers when they are
 * exposed explicitly.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(
                        CorrelationIdFilter.CORRELATION_ID_HEADER,
                        CapabilityHeadersFilter.ENTERPRISE_HEADER,
                        CapabilityHeadersFilter.NAMESPACES_HEADER,
                        CapabilityHeadersFilter.MODE_HEADER,
                        TenantContextFilter.TENANT_HEADER)
                .allowCredentials(true)
                .maxAge(3600);
    }
}
