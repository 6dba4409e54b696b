package com.switchboard.gateway.api;

import com.switchboard.database.migration.StoreMigrationStatus;
import com.switchboard.database.migration.TenantSchemaMigrator;
import com.switchboard.gateway.infrastructure.web.TenantProblemMapper;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantStatus;
import com.switchboard.tenancy.lifecycle.ProvisioningTask;
import com.switchboard.tenancy.lifecycle.RetirementTask;
import com.switchboard.tenancy.lifecycle.TenantLifecycleService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator API for the tenant lifecycle.
 *
 * <p>Registration and retirement answer {@code 202 Accepted}: provisioning and store destruction
 * run in the background, and the tenant's status shows how far they got. Illegal transitions are
 * refused with {@code 409}.
 *
 * <pre>
 * POST /admin/v1/tenants                      register (202)
 * GET  /admin/v1/tenants?status=ACTIVE        list
 * GET  /admin/v1/tenants/{id}                 read
 * POST /admin/v1/tenants/{id}/suspend         ACTIVE -> SUSPENDED
 * POST /admin/v1/tenants/{id}/reactivate      SUSPENDED -> ACTIVE
 * POST /admin/v1/tenants/{id}/retire          -> RETIRED (202)
 * POST /admin/v1/tenants/{id}/provisioning/retry
 * GET  /admin/v1/tenants/{id}/schema          migration state of the store
 * </pre>
 */
@RestController
@RequestMapping("/admin/v1/tenants")
public class TenantAdminController {

    private static final Logger log = LoggerFactory.getLogger(TenantAdminController.class);

    private static final Set<TenantStatus> INSPECTABLE = EnumSet.of(TenantStatus.ACTIVE, TenantStatus.SUSPENDED);

    private final TenantLifecycleService lifecycle;
    private final TenantSchemaMigrator migrator;

    public TenantAdminController(TenantLifecycleService lifecycle, TenantSchemaMigrator migrator) {
        this.lifecycle = lifecycle;
        this.migrator = migrator;
    }

    @PostMapping
    public ResponseEntity<TenantView> register(@Valid @RequestBody RegisterTenantRequest request) {
        ProvisioningTask task =
                lifecycle.register(request.routingKey(), request.displayName(), request.storeName());
        Tenant tenant = task.tenant();
        return ResponseEntity.accepted()
                .location(URI.create("/admin/v1/tenants/" + tenant.tenantId()))
                .body(view(tenant));
    }

    @GetMapping
    public List<TenantView> list(@RequestParam(name = "status", required = false) List<String> status) {
        return lifecycle.list(parseStatuses(status)).stream().map(this::view).toList();
    }

    @GetMapping("/{tenantId}")
    public TenantView get(@PathVariable("tenantId") String tenantId) {
        return view(lifecycle.get(tenantId));
    }

    @PostMapping("/{tenantId}/suspend")
    public TenantView suspend(
            @PathVariable("tenantId") String tenantId,
            @RequestBody(required = false) TransitionRequest request) {
        return view(lifecycle.suspend(tenantId, reasonOf(request)));
    }

    @PostMapping("/{tenantId}/reactivate")
    public TenantView reactivate(@PathVariable("tenantId") String tenantId) {
        return view(lifecycle.reactivate(tenantId));
    }

    @PostMapping("/{tenantId}/retire")
    public ResponseEntity<TenantView> retire(
            @PathVariable("tenantId") String tenantId,
            @RequestBody(required = false) TransitionRequest request) {
        RetirementTask task = lifecycle.retire(tenantId, reasonOf(request));
        return ResponseEntity.accepted().body(view(task.tenant()));
    }

    @PostMapping("/{tenantId}/provisioning/retry")
    public ResponseEntity<TenantView> retryProvisioning(@PathVariable("tenantId") String tenantId) {
        ProvisioningTask task = lifecycle.retryProvisioning(tenantId);
        return ResponseEntity.accepted().body(view(task.tenant()));
    }

    /** Only stores of active or suspended tenants are guaranteed to exist. */
    @GetMapping("/{tenantId}/schema")
    public ResponseEntity<?> schema(@PathVariable("tenantId") String tenantId) {
        Tenant tenant = lifecycle.get(tenantId);
        if (!INSPECTABLE.contains(tenant.status())) {
            log.debug("Schema of tenant '{}' requested while {}", tenantId, tenant.status());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(
                            TenantProblemMapper.problem(
                                    HttpStatus.CONFLICT,
                                    "store-not-inspectable",
                                    "Store Not Inspectable",
                                    "Tenant " + tenantId + " is " + tenant.status()));
        }
        StoreMigrationStatus status = migrator.status(tenant.storeName());
        return ResponseEntity.ok(
                new SchemaView(tenantId, migrator.targetVersion(), status.isAt(migrator.targetVersion()), status));
    }

    static Set<TenantStatus> parseStatuses(List<String> raw) {
        Set<TenantStatus> statuses = EnumSet.noneOf(TenantStatus.class);
        if (raw == null) {
            return statuses;
        }
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                statuses.add(TenantStatus.valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown tenant status: " + value, e);
            }
        }
        return statuses;
    }

    private static String reasonOf(TransitionRequest request) {
        return request == null ? null : request.reason();
    }

    private TenantView view(Tenant tenant) {
        return new TenantView(
                tenant.tenantId(),
                tenant.routingKey(),
                tenant.displayName(),
                tenant.storeName(),
                tenant.status(),
                tenant.provisioningAttempts(),
                tenant.lastError(),
                lifecycle.isProvisioning(tenant.tenantId()),
                tenant.createdAt(),
                tenant.updatedAt(),
                tenant.retiredAt(),
                tenant.storeDestroyedAt());
    }

    /**
     * @param routingKey subdomain label or custom host
     * @param displayName organisation name
     * @param storeName physical store name; derived from the routing key when omitted
     */
    public record RegisterTenantRequest(
            @NotBlank String routingKey, @NotBlank @Size(max = 200) String displayName, String storeName) {}

    /** Optional operator note recorded on the lifecycle event. */
    public record TransitionRequest(@Size(max = 500) String reason) {}

    public record TenantView(
            String tenantId,
            String routingKey,
            String displayName,
            String storeName,
            TenantStatus status,
            int provisioningAttempts,
            String lastError,
            boolean provisioningInProgress,
            Instant createdAt,
            Instant updatedAt,
            Instant retiredAt,
            Instant storeDestroyedAt) {}

    public record SchemaView(
            String tenantId, int targetVersion, boolean upToDate, StoreMigrationStatus store) {}
}
