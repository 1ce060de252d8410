package com.lattice.gateway.web;

import com.lattice.tenancy.AccessMode;
import com.lattice.tenancy.AdaptiveTenantClientFactory;
import com.lattice.tenancy.SystemTenants;
import com.lattice.tenancy.TenantContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the request's tenant from {@code X-Tenant-Id} (absent: the default tenant) and stores
 * the {@link TenantContext} as a request attribute.
 *
 * <p>Resolution uses {@link AccessMode#READ}: a tenant that cannot be resolved is served from the
 * default tenant. Writes resolve their own context with {@link AccessMode#WRITE}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class TenantContextFilter extends OncePerRequestFilter {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String HIERARCHY_HEADER = "X-Hierarchy-Id";
    public static final String CONTEXT_ATTRIBUTE = TenantContextFilter.class.getName() + ".context";

    private final AdaptiveTenantClientFactory clients;

    public TenantContextFilter(AdaptiveTenantClientFactory clients) {
        this.clients = clients;
    }

    /** The context resolved for {@code request}, if this filter ran. */
    public static Optional<TenantContext> contextOf(HttpServletRequest request) {
        return Optional.ofNullable((TenantContext) request.getAttribute(CONTEXT_ATTRIBUTE));
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String tenantId = request.getHeader(TENANT_HEADER);
        if (tenantId == null || tenantId.isBlank()) {
            tenantId = SystemTenants.DEFAULT_TENANT;
        }
        TenantContext context = clients.resolveContext(tenantId, AccessMode.READ);
        request.setAttribute(CONTEXT_ATTRIBUTE, context);
        response.setHeader(TENANT_HEADER, context.tenantId());

        filterChain.doFilter(request, response);
    }
}
