package com.switchboard.tenancy.lifecycle;

import com.switchboard.eventmodel.EventEntity;
import com.switchboard.eventmodel.EventEnvelope;
import com.switchboard.eventmodel.EventFactory;
import com.switchboard.eventmodel.EventType;
import com.switchboard.observability.CorrelationContext;
import com.switchboard.observability.CorrelationContextHolder;
import com.switchboard.observability.MetricFactory;
import com.switchboard.observability.SpanHelper;
import com.switchboard.tenancy.OperatorAlerts;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantStatus;
import com.switchboard.tenancy.TenantValidationException;
import com.switchboard.tenancy.TenantValidationResult;
import com.switchboard.tenancy.TenantValidator;
import com.switchboard.tenancy.registry.DuplicateTenantException;
import com.switchboard.tenancy.registry.TenantChangeListener;
import com.switchboard.tenancy.registry.TenantRegistry;
import com.switchboard.tenancy.store.StoreSwitchboard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * Drives tenants through their lifecycle: registration, provisioning with retries, suspension,
 * reactivation and retirement.
 * <p>
 * Every status write is a compare-and-set on the registry. A transition that loses a race, or
 * starts from the wrong status, fails with {@link TenantTransitionException} and leaves the
 * registry at whatever the winner wrote. After each successful write the local resolver cache is
 * invalidated and a lifecycle event is published.
 * <p>
 * Provisioning and store destruction run on the supplied scheduler. The correlation context of
 * the call that started them is carried onto the scheduler threads for logging.
 * <p>
 * A store is only marked destroyed in the registry once the executor has dropped it. Retired
 * tenants without that mark are picked up again by {@link #resumeRetirements()}, so a destruction
 * scheduled before a restart is not lost with the scheduler.
 */
public final class TenantLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TenantLifecycleService.class);

    /** Producer name stamped on every lifecycle event. */
    public static final String PRODUCER = "tenant-lifecycle";

    /** Timer recording each provisioning attempt, tagged by outcome. */
    public static final String PROVISIONING_METRIC = "switchboard.provisioning.attempt";

    private static final Set<TenantStatus> NEEDS_PROVISIONING =
            EnumSet.of(TenantStatus.PENDING, TenantStatus.PROVISIONING);

    private final TenantRegistry registry;
    private final ProvisioningExecutor executor;
    private final StoreSwitchboard switchboard;
    private final TenantEventPublisher publisher;
    private final OperatorAlerts alerts;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final LifecycleSettings settings;
    private final SpanHelper spans;
    private final MetricFactory metrics;
    private final List<TenantChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ProvisioningOutcome>> provisioning = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> retirements = new ConcurrentHashMap<>();

    public TenantLifecycleService(TenantRegistry registry, ProvisioningExecutor executor,
                                  StoreSwitchboard switchboard, TenantEventPublisher publisher,
                                  OperatorAlerts alerts, ScheduledExecutorService scheduler,
                                  Clock clock, LifecycleSettings settings, SpanHelper spans,
                                  MetricFactory metrics) {
        this.registry = registry;
        this.executor = executor;
        this.switchboard = switchboard;
        this.publisher = publisher;
        this.alerts = alerts;
        this.scheduler = scheduler;
        this.clock = clock;
        this.settings = settings;
        this.spans = spans;
        this.metrics = metrics;
    }

    /**
     * Registers a listener notified after every registry write made by this service.
     */
    public void addChangeListener(TenantChangeListener listener) {
        listeners.add(listener);
    }

    // ---- registration and provisioning ----

    /**
     * Registers a tenant in {@link TenantStatus#PENDING} and starts provisioning its store.
     *
     * @param routingKey  subdomain label or custom host (case-insensitive)
     * @param displayName organisation name
     * @param storeName   physical store name; derived from the routing key when null or blank
     * @throws TenantValidationException if the input is invalid
     * @throws DuplicateTenantException  if the routing key or store name is taken
     */
    public ProvisioningTask register(String routingKey, String displayName, String storeName) {
        String key = routingKey == null ? null : routingKey.trim().toLowerCase(Locale.ROOT);
        String store = storeName == null || storeName.isBlank()
                ? (key == null || key.isEmpty() ? null : TenantValidator.deriveStoreName(key))
                : storeName;

        TenantValidationResult validation = TenantValidator.validate(key, displayName, store);
        if (!validation.valid()) {
            throw new TenantValidationException(validation.errors());
        }

        Tenant created = registry.create(
                Tenant.pending(UUID.randomUUID().toString(), key, displayName, store, clock.instant()));
        notifyChanged(created);
        publish(null, EventType.TENANT_REGISTERED, created, null, TenantStatus.PENDING, 0, null);
        log.info("Registered tenant '{}' routingKey={} store={}", created.tenantId(), key, store);

        return new ProvisioningTask(created, startProvisioning(created));
    }

    /**
     * Restarts provisioning for a pending tenant, typically one that was escalated. The attempt
     * counter starts again from one. If a run is already in progress its task is returned.
     *
     * @throws TenantNotFoundException   if the tenant does not exist
     * @throws TenantTransitionException if the tenant is not pending
     */
    public ProvisioningTask retryProvisioning(String tenantId) {
        Tenant tenant = get(tenantId);
        CompletableFuture<ProvisioningOutcome> running = provisioning.get(tenantId);
        if (running != null) {
            return new ProvisioningTask(tenant, running);
        }
        if (tenant.status() != TenantStatus.PENDING) {
            throw new TenantTransitionException(tenantId, TenantStatus.PROVISIONING, tenant.status());
        }
        Tenant reset = registry.updateProvisioningAttempts(tenantId, 0, tenant.lastError(), clock.instant())
                .orElseThrow(() -> new TenantNotFoundException(tenantId));
        log.info("Operator restarted provisioning for tenant '{}'", tenantId);
        return new ProvisioningTask(reset, startProvisioning(reset));
    }

    /**
     * Restarts provisioning for every tenant left pending or half-provisioned, e.g. after a
     * restart. Tenants whose attempts are exhausted stay pending until an operator retries them.
     *
     * @return the runs that were started
     */
    public List<ProvisioningTask> resumePending() {
        List<ProvisioningTask> tasks = new ArrayList<>();
        for (Tenant tenant : registry.findByStatus(NEEDS_PROVISIONING)) {
            if (provisioning.containsKey(tenant.tenantId())) {
                continue;
            }
            Tenant pending = tenant;
            if (tenant.status() == TenantStatus.PROVISIONING) {
                Optional<Tenant> reset = registry.compareAndSetStatus(tenant.tenantId(),
                        TenantStatus.PROVISIONING, TenantStatus.PENDING, clock.instant());
                if (reset.isEmpty()) {
                    continue;
                }
                pending = reset.get();
                notifyChanged(pending);
                publish(null, EventType.PROVISIONING_FAILED, pending, TenantStatus.PROVISIONING,
                        TenantStatus.PENDING, tenant.provisioningAttempts(), "interrupted before completion");
            }
            if (pending.provisioningAttempts() >= settings.maxProvisioningAttempts()) {
                log.warn("Tenant '{}' is escalated after {} attempts, waiting for operator retry",
                        pending.tenantId(), pending.provisioningAttempts());
                continue;
            }
            tasks.add(new ProvisioningTask(pending, startProvisioning(pending)));
        }
        if (!tasks.isEmpty()) {
            log.info("Resumed provisioning for {} tenant(s)", tasks.size());
        }
        return tasks;
    }

    /**
     * Whether a provisioning run is in progress for the tenant on this node.
     */
    public boolean isProvisioning(String tenantId) {
        return provisioning.containsKey(tenantId);
    }

    private CompletableFuture<ProvisioningOutcome> startProvisioning(Tenant tenant) {
        String tenantId = tenant.tenantId();
        CompletableFuture<ProvisioningOutcome> outcome = new CompletableFuture<>();
        CompletableFuture<ProvisioningOutcome> running = provisioning.putIfAbsent(tenantId, outcome);
        if (running != null) {
            return running;
        }

        int firstAttempt = tenant.provisioningAttempts() + 1;
        try {
            scheduler.execute(inCurrentContext(() -> runAttempt(tenantId, firstAttempt, outcome)));
        } catch (RejectedExecutionException e) {
            fail(tenantId, outcome, e);
        }
        return outcome;
    }

    /** A claimed tenant whose store has been handed to the executor. */
    private record Dispatch(Tenant claimed, EventEnvelope<TenantLifecyclePayload> requested,
                            CompletableFuture<ProvisioningResult> result) {
    }

    private void runAttempt(String tenantId, int attempt, CompletableFuture<ProvisioningOutcome> outcome) {
        try {
            Instant started = clock.instant();
            Dispatch dispatch = spans.inSpan("tenant.provision",
                    Map.of("tenant.id", tenantId, "provisioning.attempt", String.valueOf(attempt)),
                    () -> dispatch(tenantId, attempt));
            dispatch.result().whenComplete(inCurrentContext((ProvisioningResult r, Throwable err) ->
                    completeAttempt(dispatch.claimed(), attempt, started, dispatch.requested(), r, err, outcome)));
        } catch (RuntimeException e) {
            log.error("Provisioning attempt {} for tenant '{}' aborted", attempt, tenantId, e);
            fail(tenantId, outcome, e);
        }
    }

    private Dispatch dispatch(String tenantId, int attempt) {
        Tenant claimed = transition(tenantId, TenantStatus.PENDING, TenantStatus.PROVISIONING);
        EventEnvelope<TenantLifecyclePayload> requested = publish(null, EventType.PROVISIONING_REQUESTED,
                claimed, TenantStatus.PENDING, TenantStatus.PROVISIONING, attempt, null);
        log.info("Provisioning store '{}' for tenant '{}' (attempt {}/{})",
                claimed.storeName(), tenantId, attempt, settings.maxProvisioningAttempts());

        CompletableFuture<ProvisioningResult> result;
        try {
            result = executor.provision(claimed);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return new Dispatch(claimed, requested, result);
    }

    private void completeAttempt(Tenant tenant, int attempt, Instant started,
                                 EventEnvelope<TenantLifecyclePayload> requested,
                                 ProvisioningResult result, Throwable error,
                                 CompletableFuture<ProvisioningOutcome> outcome) {
        String tenantId = tenant.tenantId();
        try {
            String failure = failureMessage(result, error);
            metrics.timer(PROVISIONING_METRIC, "Provisioning attempts by outcome",
                            "outcome", failure == null ? "active" : "failed")
                    .record(Duration.between(started, clock.instant()));
            if (failure == null) {
                registry.updateProvisioningAttempts(tenantId, 0, null, clock.instant());
                Tenant active = transition(tenantId, TenantStatus.PROVISIONING, TenantStatus.ACTIVE);
                publish(requested, EventType.TENANT_ACTIVATED, active, TenantStatus.PROVISIONING,
                        TenantStatus.ACTIVE, attempt, null);
                log.info("Tenant '{}' is active at schema version {}", tenantId, result.schemaVersion());
                finish(tenantId, outcome, ProvisioningOutcome.active(active, attempt));
                return;
            }

            registry.updateProvisioningAttempts(tenantId, attempt, failure, clock.instant());
            Tenant pending = transition(tenantId, TenantStatus.PROVISIONING, TenantStatus.PENDING);
            publish(requested, EventType.PROVISIONING_FAILED, pending, TenantStatus.PROVISIONING,
                    TenantStatus.PENDING, attempt, failure);

            if (attempt >= settings.maxProvisioningAttempts()) {
                publish(requested, EventType.PROVISIONING_ESCALATED, pending, TenantStatus.PENDING,
                        TenantStatus.PENDING, attempt, failure);
                alerts.raise(tenantId, "provisioning_escalated",
                        "Provisioning store '%s' failed %d time(s): %s".formatted(tenant.storeName(), attempt, failure),
                        unwrap(error));
                finish(tenantId, outcome, ProvisioningOutcome.escalated(pending, attempt, failure));
                return;
            }

            Duration delay = settings.provisioningBackoff().delayAfter(attempt);
            log.warn("Provisioning attempt {} for tenant '{}' failed: {}. Retrying in {} ms",
                    attempt, tenantId, failure, delay.toMillis());
            scheduler.schedule(inCurrentContext(() -> runAttempt(tenantId, attempt + 1, outcome)),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.error("Completing provisioning attempt {} for tenant '{}' failed", attempt, tenantId, e);
            fail(tenantId, outcome, e);
        }
    }

    // removed before completion: a caller woken by the future must not see the run as in progress
    private void finish(String tenantId, CompletableFuture<ProvisioningOutcome> outcome, ProvisioningOutcome result) {
        provisioning.remove(tenantId, outcome);
        outcome.complete(result);
    }

    private void fail(String tenantId, CompletableFuture<ProvisioningOutcome> outcome, Throwable error) {
        provisioning.remove(tenantId, outcome);
        outcome.completeExceptionally(error);
    }

    private String failureMessage(ProvisioningResult result, Throwable error) {
        if (error != null) {
            Throwable cause = unwrap(error);
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        if (result == null) {
            return "executor reported no result";
        }
        if (result.schemaVersion() != executor.targetSchemaVersion()) {
            return "store '%s' reports schema version %d, expected %d"
                    .formatted(result.storeName(), result.schemaVersion(), executor.targetSchemaVersion());
        }
        return null;
    }

    // ---- operator transitions ----

    /**
     * Suspends an active tenant. Requests already holding a handle finish; new ones are refused.
     *
     * @throws TenantTransitionException if the tenant is not active
     */
    public Tenant suspend(String tenantId, String reason) {
        Tenant suspended = transition(tenantId, TenantStatus.ACTIVE, TenantStatus.SUSPENDED);
        publish(null, EventType.TENANT_SUSPENDED, suspended, TenantStatus.ACTIVE, TenantStatus.SUSPENDED, 0, reason);
        log.info("Suspended tenant '{}': {}", tenantId, reason);
        return suspended;
    }

    /**
     * Reactivates a suspended tenant.
     *
     * @throws TenantTransitionException if the tenant is not suspended
     */
    public Tenant reactivate(String tenantId) {
        Tenant active = transition(tenantId, TenantStatus.SUSPENDED, TenantStatus.ACTIVE);
        publish(null, EventType.TENANT_REACTIVATED, active, TenantStatus.SUSPENDED, TenantStatus.ACTIVE, 0, null);
        log.info("Reactivated tenant '{}'", tenantId);
        return active;
    }

    /**
     * Retires an active or suspended tenant. The tenant is sealed in the switchboard at once;
     * its store is destroyed once the retention window has passed and every in-flight handle is
     * released. The retention window counts from the {@code retiredAt} stamp in the registry.
     *
     * @throws TenantTransitionException if the tenant is neither active nor suspended
     */
    public RetirementTask retire(String tenantId, String reason) {
        Tenant current = get(tenantId);
        if (!current.status().canTransitionTo(TenantStatus.RETIRED)) {
            throw new TenantTransitionException(tenantId, TenantStatus.RETIRED, current.status());
        }
        Tenant retired = transition(tenantId, current.status(), TenantStatus.RETIRED);
        CompletableFuture<Void> drained = switchboard.retire(tenantId);
        publish(null, EventType.TENANT_RETIRED, retired, current.status(), TenantStatus.RETIRED, 0, reason);
        log.info("Retired tenant '{}', store '{}' will be destroyed after {}",
                tenantId, retired.storeName(), settings.retentionWindow());

        return new RetirementTask(retired, scheduleDestroy(retired, drained, settings.retentionWindow()));
    }

    /**
     * Schedules destruction for every retired tenant whose store is not yet marked destroyed and
     * is not already scheduled on this node, e.g. after a restart. Tenants still inside their
     * retention window wait for the remainder of it.
     *
     * @return the destructions that were scheduled
     */
    public List<RetirementTask> resumeRetirements() {
        List<RetirementTask> tasks = new ArrayList<>();
        Instant now = clock.instant();
        for (Tenant tenant : registry.findByStatus(EnumSet.of(TenantStatus.RETIRED))) {
            if (tenant.storeDestroyedAt() != null || retirements.containsKey(tenant.tenantId())) {
                continue;
            }
            Instant retiredAt = tenant.retiredAt() != null ? tenant.retiredAt() : tenant.updatedAt();
            Duration remaining = Duration.between(now, retiredAt.plus(settings.retentionWindow()));
            Duration delay = remaining.isNegative() ? Duration.ZERO : remaining;
            CompletableFuture<Void> drained = switchboard.retire(tenant.tenantId());
            tasks.add(new RetirementTask(tenant, scheduleDestroy(tenant, drained, delay)));
            log.info("Store '{}' of retired tenant '{}' will be destroyed in {}",
                    tenant.storeName(), tenant.tenantId(), delay);
        }
        if (!tasks.isEmpty()) {
            log.info("Resumed store destruction for {} retired tenant(s)", tasks.size());
        }
        return tasks;
    }

    private CompletableFuture<Void> scheduleDestroy(Tenant retired, CompletableFuture<Void> drained, Duration delay) {
        CompletableFuture<Void> destroyed = new CompletableFuture<>();
        CompletableFuture<Void> scheduled = retirements.putIfAbsent(retired.tenantId(), destroyed);
        if (scheduled != null) {
            return scheduled;
        }
        try {
            scheduler.schedule(inCurrentContext(() -> destroyAttempt(retired, 1, drained, destroyed, null)),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            endRetirement(retired, destroyed, e);
        }
        return destroyed;
    }

    // bookkeeping is dropped before completion: a caller woken by the future may sweep again
    private void endRetirement(Tenant tenant, CompletableFuture<Void> destroyed, Throwable error) {
        retirements.remove(tenant.tenantId(), destroyed);
        sequences.remove(tenant.tenantId());
        if (error == null) {
            destroyed.complete(null);
        } else {
            destroyed.completeExceptionally(error);
        }
    }

    private void destroyAttempt(Tenant tenant, int attempt, CompletableFuture<Void> drained,
                                CompletableFuture<Void> destroyed, EventEnvelope<TenantLifecyclePayload> request) {
        EventEnvelope<TenantLifecyclePayload> requested = request != null ? request
                : publish(null, EventType.STORE_DESTROY_REQUESTED, tenant, TenantStatus.RETIRED,
                        TenantStatus.RETIRED, attempt, null);

        CompletableFuture<Void> result = drained.thenCompose(ignored -> executor.destroy(tenant));
        result.whenComplete(inCurrentContext((Void ignored, Throwable error) -> {
            try {
                completeDestroy(tenant, attempt, drained, destroyed, requested, error);
            } catch (RuntimeException e) {
                log.error("Completing destruction of store '{}' failed", tenant.storeName(), e);
                endRetirement(tenant, destroyed, e);
            }
        }));
    }

    private void completeDestroy(Tenant tenant, int attempt, CompletableFuture<Void> drained,
                                 CompletableFuture<Void> destroyed,
                                 EventEnvelope<TenantLifecyclePayload> requested, Throwable error) {
        if (error == null) {
            registry.markStoreDestroyed(tenant.tenantId(), clock.instant()).ifPresent(this::notifyChanged);
            publish(requested, EventType.STORE_DESTROYED, tenant, TenantStatus.RETIRED,
                    TenantStatus.RETIRED, attempt, null);
            log.info("Destroyed store '{}' of retired tenant '{}'", tenant.storeName(), tenant.tenantId());
            switchboard.forget(tenant.tenantId());
            endRetirement(tenant, destroyed, null);
            return;
        }
        Throwable cause = unwrap(error);
        String failure = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        registry.updateProvisioningAttempts(tenant.tenantId(), tenant.provisioningAttempts(), failure,
                clock.instant());
        publish(requested, EventType.STORE_DESTROY_FAILED, tenant, TenantStatus.RETIRED,
                TenantStatus.RETIRED, attempt, failure);

        if (attempt >= settings.maxDestroyAttempts()) {
            alerts.raise(tenant.tenantId(), "store_destroy_escalated",
                    "Destroying store '%s' failed %d time(s): %s".formatted(tenant.storeName(), attempt, failure),
                    cause);
            endRetirement(tenant, destroyed, new ProvisioningFailedException(tenant.tenantId(),
                    "Store '%s' could not be destroyed".formatted(tenant.storeName()), cause));
            return;
        }
        Duration delay = settings.destroyBackoff().delayAfter(attempt);
        log.warn("Destroying store '{}' failed (attempt {}): {}. Retrying in {} ms",
                tenant.storeName(), attempt, failure, delay.toMillis());
        scheduler.schedule(inCurrentContext(() -> destroyAttempt(tenant, attempt + 1, drained, destroyed, requested)),
                delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ---- queries ----

    /**
     * @throws TenantNotFoundException if the tenant does not exist
     */
    public Tenant get(String tenantId) {
        return registry.findById(tenantId).orElseThrow(() -> new TenantNotFoundException(tenantId));
    }

    public List<Tenant> list(Set<TenantStatus> statuses) {
        return registry.findByStatus(statuses.isEmpty() ? EnumSet.allOf(TenantStatus.class) : statuses);
    }

    // ---- internals ----

    private Tenant transition(String tenantId, TenantStatus expected, TenantStatus next) {
        if (!expected.canTransitionTo(next)) {
            throw new TenantTransitionException(tenantId, next, expected);
        }
        Optional<Tenant> updated = registry.compareAndSetStatus(tenantId, expected, next, clock.instant());
        if (updated.isEmpty()) {
            TenantStatus actual = registry.findById(tenantId)
                    .map(Tenant::status)
                    .orElseThrow(() -> new TenantNotFoundException(tenantId));
            throw new TenantTransitionException(tenantId, next, actual);
        }
        notifyChanged(updated.get());
        return updated.get();
    }

    private void notifyChanged(Tenant tenant) {
        for (TenantChangeListener listener : listeners) {
            listener.tenantChanged(tenant);
        }
    }

    private EventEnvelope<TenantLifecyclePayload> publish(EventEnvelope<TenantLifecyclePayload> cause,
                                                          EventType type, Tenant tenant,
                                                          TenantStatus from, TenantStatus to,
                                                          int attempt, String reason) {
        var payload = new TenantLifecyclePayload(tenant.routingKey(), tenant.storeName(), from, to, attempt, reason);
        var entity = EventEntity.tenant(tenant.tenantId(), nextSequence(tenant.tenantId()));
        EventEnvelope<TenantLifecyclePayload> event = cause == null
                ? EventFactory.create(type, PRODUCER, tenant.tenantId(), currentCorrelationId(), entity, payload)
                : EventFactory.createCausedBy(cause, type, PRODUCER, entity, payload);
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            log.error("Publishing {} for tenant '{}' failed", type.value(), tenant.tenantId(), e);
        }
        return event;
    }

    private long nextSequence(String tenantId) {
        return sequences.computeIfAbsent(tenantId, id -> new AtomicLong()).incrementAndGet();
    }

    private static String currentCorrelationId() {
        return CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null);
    }

    private static Runnable inCurrentContext(Runnable work) {
        Optional<CorrelationContext> context = CorrelationContextHolder.get();
        if (context.isEmpty()) {
            return work;
        }
        return () -> CorrelationContextHolder.runWithContext(context.get(), work);
    }

    private static <T> BiConsumer<T, Throwable> inCurrentContext(BiConsumer<T, Throwable> callback) {
        Optional<CorrelationContext> context = CorrelationContextHolder.get();
        if (context.isEmpty()) {
            return callback;
        }
        return (value, error) -> CorrelationContextHolder.runWithContext(context.get(),
                () -> callback.accept(value, error));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
