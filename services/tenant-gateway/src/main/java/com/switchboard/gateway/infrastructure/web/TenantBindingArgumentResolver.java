package com.switchboard.gateway.infrastructure.web;

import com.switchboard.tenancy.TenantIsolationEnforcer;
import com.switchboard.tenancy.routing.TenantBinding;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the request's {@link TenantBinding} into controller methods that declare it.
 *
 * <p>Only routes behind {@link TenantBindingFilter} have a binding. Declaring one on any other
 * route is a wiring mistake and fails loudly instead of running without a tenant.
 *
 * <p>A client may also name the tenant it expects in {@value #TENANT_HEADER}. The header never
 * selects a tenant: it must match the one the host resolved to, or the request is refused.
 */
public class TenantBindingArgumentResolver implements HandlerMethodArgumentResolver {

    /** Optional request header carrying the tenant id the caller expects to be bound to. */
    public static final String TENANT_HEADER = "X-Tenant-ID";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return TenantBinding.class.equals(parameter.getParameterType());
    }

    @Override
    public TenantBinding resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        Object binding =
                webRequest.getAttribute(
                        TenantBindingFilter.BINDING_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (!(binding instanceof TenantBinding tenantBinding)) {
            throw new IllegalStateException(
                    "No tenant binding for "
                            + parameter.getExecutable().getName()
                            + "; the route is not behind the tenant binding filter");
        }
        String expectedTenant = webRequest.getHeader(TENANT_HEADER);
        if (expectedTenant != null && !expectedTenant.isBlank()) {
            TenantIsolationEnforcer.enforce(tenantBinding, expectedTenant.trim());
        }
        return tenantBinding;
    }
}
