package com.lattice.gateway.web;

import com.lattice.tenancy.capability.CapabilityCache;
import com.lattice.tenancy.capability.TenantCapabilities;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Adds the detected capabilities to every response, so clients can adapt without a separate
 * capability call. Triggers detection on the first request if startup detection is disabled.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CapabilityHeadersFilter extends OncePerRequestFilter {

    public static final String ENTERPRISE_HEADER = "X-Graph-Enterprise";
    public static final String NAMESPACES_HEADER = "X-Graph-Namespaces";
    public static final String MODE_HEADER = "X-Graph-Mode";

    private final CapabilityCache capabilities;

    public CapabilityHeadersFilter(CapabilityCache capabilities) {
        this.capabilities = capabilities;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        TenantCapabilities caps = capabilities.ensureDetected();
        response.setHeader(ENTERPRISE_HEADER, Boolean.toString(caps.enterpriseDetected()));
        response.setHeader(NAMESPACES_HEADER, Boolean.toString(caps.namespacesSupported()));
        response.setHeader(MODE_HEADER, caps.mode().wireName());

        filterChain.doFilter(request, response);
    }
}
