package com.switchboard.gateway.application;

import com.switchboard.gateway.config.SwitchboardProperties;
import com.switchboard.tenancy.lifecycle.ProvisioningTask;
import com.switchboard.tenancy.lifecycle.RetirementTask;
import com.switchboard.tenancy.lifecycle.TenantLifecycleService;
import com.switchboard.tenancy.store.StoreSwitchboard;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background housekeeping for the switchboard and the tenant lifecycle.
 *
 * <ul>
 *   <li>Idle tenant pools are swept every {@code switchboard.maintenance.evict-interval}, an
 *       ISO-8601 duration such as {@code PT1M}.
 *   <li>Provisioning interrupted by the previous shutdown is resumed once the gateway is ready,
 *       and so is the destruction of retired tenants' stores not yet marked destroyed.
 *   <li>On shutdown every pool is drained, waiting at most {@link #DRAIN_TIMEOUT}.
 * </ul>
 */
@Component
public class SwitchboardMaintenance {

    private static final Logger log = LoggerFactory.getLogger(SwitchboardMaintenance.class);

    static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(20);

    private final StoreSwitchboard switchboard;
    private final TenantLifecycleService lifecycle;
    private final SwitchboardProperties properties;

    public SwitchboardMaintenance(
            StoreSwitchboard switchboard, TenantLifecycleService lifecycle, SwitchboardProperties properties) {
        this.switchboard = switchboard;
        this.lifecycle = lifecycle;
        this.properties = properties;
    }

    @Scheduled(
            fixedDelayString = "${switchboard.maintenance.evict-interval:PT1M}",
            initialDelayString = "${switchboard.maintenance.evict-interval:PT1M}")
    public void evictIdlePools() {
        int evicted = switchboard.evictIdle();
        if (evicted > 0) {
            log.info("Evicted {} idle tenant pool(s), {} remain open", evicted, switchboard.poolCount());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeProvisioning() {
        if (!properties.maintenance().resumeOnStartup()) {
            log.info("Provisioning resume on startup is disabled");
            return;
        }
        List<ProvisioningTask> resumed = lifecycle.resumePending();
        List<RetirementTask> retirements = lifecycle.resumeRetirements();
        log.info("Startup check resumed provisioning for {} tenant(s) and store destruction for {}",
                resumed.size(), retirements.size());
    }

    @PreDestroy
    public void drainPools() {
        log.info("Draining {} tenant pool(s)", switchboard.poolCount());
        try {
            switchboard.drainAll().get(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining tenant pools");
        } catch (ExecutionException e) {
            log.warn("Draining tenant pools failed", e.getCause());
        } catch (TimeoutException e) {
            log.warn("Tenant pools still busy after {}, {} session(s) checked out",
                    DRAIN_TIMEOUT, switchboard.totalCheckedOut());
        }
    }
}
