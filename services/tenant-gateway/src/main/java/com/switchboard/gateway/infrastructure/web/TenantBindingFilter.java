package com.switchboard.gateway.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.observability.CorrelationContextHolder;
import com.switchboard.tenancy.RequestKind;
import com.switchboard.tenancy.TenantAccessException;
import com.switchboard.tenancy.routing.TenantBinding;
import com.switchboard.tenancy.routing.TenantRouter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds every tenant-facing request to exactly one tenant and one store handle.
 *
 * <p>The tenant is resolved from the request's server name ({@code Host}). {@code GET},
 * {@code HEAD}, {@code OPTIONS} and {@code TRACE} bind as reads, everything else as mutations.
 * The binding lives in a request attribute for {@link TenantBindingArgumentResolver}; it is
 * closed, and its handle released, when the filter chain returns or throws.
 *
 * <p>Resolution and acquisition failures never reach a controller: they are answered here with
 * the problem from {@link TenantProblemMapper}.
 */
public class TenantBindingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TenantBindingFilter.class);

    /** Request attribute holding the {@link TenantBinding}. */
    public static final String BINDING_ATTRIBUTE = TenantBinding.class.getName();

    private final TenantRouter router;
    private final TenantProblemMapper problems;
    private final ObjectMapper objectMapper;

    public TenantBindingFilter(TenantRouter router, TenantProblemMapper problems, ObjectMapper objectMapper) {
        this.router = router;
        this.problems = problems;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String host = request.getServerName();
        RequestKind kind = RequestKind.fromHttpMethod(request.getMethod());

        TenantBinding binding;
        try {
            binding = router.bind(host, kind);
        } catch (TenantAccessException e) {
            if (e.retryable()) {
                log.warn("Cannot bind {} {} for host {}: {}", request.getMethod(), request.getRequestURI(),
                        host, e.getMessage());
            } else {
                log.debug("Refused {} {} for host {}: {}", request.getMethod(), request.getRequestURI(),
                        host, e.failure().code());
            }
            problems.write(response, e, objectMapper);
            return;
        }

        try (TenantBinding bound = binding) {
            CorrelationContextHolder.attachTenant(bound.tenantId(), bound.tenant().routingKey());
            request.setAttribute(BINDING_ATTRIBUTE, bound);
            filterChain.doFilter(request, response);
        } finally {
            request.removeAttribute(BINDING_ATTRIBUTE);
        }
    }
}
