package com.lattice.gateway.web;

import com.lattice.observability.CorrelationContext;
import com.lattice.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a {@link CorrelationContext} to the request thread before any other filter runs.
 *
 * <p>A caller-supplied {@code X-Correlation-ID} is kept when it is a plain token (letters, digits,
 * {@code . _ : -}, at most 128 characters); anything else is replaced by a random UUID so it
 * cannot reach the logs. The id is echoed in the response and stored as a request attribute.
 * {@link TenantContextFilter} later enriches the same context with the tenant.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".id";

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    /** The correlation id assigned to {@code request}, if this filter ran. */
    public static Optional<String> correlationIdOf(HttpServletRequest request) {
        return Optional.ofNullable((String) request.getAttribute(CORRELATION_ID_ATTRIBUTE));
    }

    static String resolveCorrelationId(String supplied) {
        if (supplied != null) {
            String trimmed = supplied.trim();
            if (TOKEN.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        request.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        CorrelationContextHolder.set(CorrelationContext.of(correlationId));
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }
}
