package com.switchboard.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.gateway.infrastructure.web.TenantBindingArgumentResolver;
import com.switchboard.gateway.infrastructure.web.TenantBindingFilter;
import com.switchboard.gateway.infrastructure.web.TenantProblemMapper;
import com.switchboard.tenancy.routing.TenantRouter;
import java.util.List;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: tenant binding for the tenant-facing API and argument resolution for
 * controllers that take a {@link com.switchboard.tenancy.routing.TenantBinding}.
 *
 * <p>Only {@value #TENANT_API_PATTERN} is bound to a tenant. Admin and actuator routes are served
 * on any host and never touch a tenant store.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    /** Servlet URL pattern of the tenant-facing API. */
    public static final String TENANT_API_PATTERN = "/api/*";

    @Bean
    public TenantProblemMapper tenantProblemMapper(SwitchboardProperties properties) {
        return new TenantProblemMapper(properties.retryAfter());
    }

    /** Runs after {@code CorrelationIdFilter}, so binding failures are logged with a correlation ID. */
    @Bean
    public FilterRegistrationBean<TenantBindingFilter> tenantBindingFilter(
            TenantRouter router, TenantProblemMapper problems, ObjectMapper objectMapper) {
        var registration =
                new FilterRegistrationBean<>(new TenantBindingFilter(router, problems, objectMapper));
        registration.addUrlPatterns(TENANT_API_PATTERN);
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new TenantBindingArgumentResolver());
    }
}
