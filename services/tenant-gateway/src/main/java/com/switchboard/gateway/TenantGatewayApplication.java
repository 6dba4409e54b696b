package com.switchboard.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Tenant gateway: resolves every request's host to a tenant and routes it to that tenant's
 * own store.
 *
 * <ul>
 *   <li>{@code /api/v1/**} is tenant-scoped, bound by host
 *   <li>{@code /admin/v1/**} manages tenants and inspects the switchboard
 *   <li>{@code /actuator/**} exposes health, metrics and Prometheus
 * </ul>
 *
 * <p>Boot's single-{@code DataSource} and Flyway auto-configuration are excluded: the registry
 * and the tenant stores are configured by {@code TenantDatabaseConfig}, and tenant stores are
 * migrated one by one while they are provisioned.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableScheduling
public class TenantGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(TenantGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TenantGatewayApplication.class, args);
        log.info("Tenant gateway started");
    }
}
