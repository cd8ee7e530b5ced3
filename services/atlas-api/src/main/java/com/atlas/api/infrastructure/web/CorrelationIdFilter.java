package com.atlas.api.infrastructure.web;

import com.atlas.observability.CorrelationContext;
import com.atlas.observability.CorrelationContextHolder;
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
 * Establishes the {@link CorrelationContext} for every HTTP request.
 *
 * <p>{@code X-Correlation-ID} is propagated when the caller sends one, otherwise generated, and is
 * echoed on the response. The tenant from {@code X-Tenant-Id} is attached when present so that log
 * lines of tenant-scoped requests carry it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        CorrelationContext context = CorrelationContext.start(request.getHeader(CORRELATION_ID_HEADER));
        String tenant = request.getHeader(TenantHeader.NAME);
        if (tenant != null && !tenant.isBlank()) {
            context = context.withTenant(tenant);
        }
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Servlet threads are pooled.
            CorrelationContextHolder.clear();
        }
    }
}
