package com.switchboard.gateway.api;

import com.switchboard.gateway.config.SwitchboardProperties;
import com.switchboard.observability.HealthCheckRegistry;
import com.switchboard.observability.HealthResult;
import com.switchboard.tenancy.store.PoolStats;
import com.switchboard.tenancy.store.StoreSwitchboard;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of the store switchboard: which tenant pools are open, how busy they are,
 * and a manual eviction for a pool an operator wants rebuilt.
 *
 * <p>Actuator's {@code /actuator/health} answers whether the gateway should take traffic; this
 * controller adds the per-tenant detail.
 */
@RestController
@RequestMapping("/admin/v1/switchboard")
public class SwitchboardInfoController {

    private final SwitchboardProperties properties;
    private final StoreSwitchboard switchboard;
    private final HealthCheckRegistry healthChecks;
    private final Clock clock;

    public SwitchboardInfoController(
            SwitchboardProperties properties,
            StoreSwitchboard switchboard,
            HealthCheckRegistry healthChecks,
            Clock clock) {
        this.properties = properties;
        this.switchboard = switchboard;
        this.healthChecks = healthChecks;
        this.clock = clock;
    }

    @GetMapping
    public Map<String, Object> info() {
        var pool = switchboard.settings().pool();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.serviceName());
        info.put("baseDomains", properties.baseDomains());
        info.put("pools", switchboard.poolCount());
        info.put("maxPools", switchboard.settings().maxPools());
        info.put("checkedOut", switchboard.totalCheckedOut());
        info.put("poolMaxSize", pool.maxSize());
        info.put("acquireTimeout", pool.acquireTimeout().toString());
        info.put("idleEvictAfter", switchboard.settings().idleEvictAfter().toString());
        info.put("timestamp", clock.instant().toString());
        return info;
    }

    @GetMapping("/pools")
    public List<PoolStats> pools() {
        return switchboard.stats();
    }

    @GetMapping("/pools/{tenantId}")
    public ResponseEntity<PoolStats> pool(@PathVariable("tenantId") String tenantId) {
        return ResponseEntity.of(switchboard.stats(tenantId));
    }

    /** Drops the tenant's pool; in-flight requests finish and the next request opens a new one. */
    @PostMapping("/pools/{tenantId}/evict")
    public ResponseEntity<Void> evict(@PathVariable("tenantId") String tenantId) {
        if (switchboard.stats(tenantId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        switchboard.evict(tenantId);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public HealthResult health() {
        return healthChecks.checkAll();
    }
}
