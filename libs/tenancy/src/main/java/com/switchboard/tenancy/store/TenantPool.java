package com.switchboard.tenancy.store;

import com.switchboard.tenancy.AcquisitionCancelledException;
import com.switchboard.tenancy.PoolExhaustedException;
import com.switchboard.tenancy.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded session pool for a single tenant store.
 * <p>
 * A fair semaphore caps checked-out sessions at {@link PoolSettings#maxSize()}. The semaphore
 * belongs to the tenant rather than the pool, so a replacement pool created while an evicted one
 * is still draining shares the same bound. Idle sessions are
 * kept in a stack so the most recently released one is reused first. Once {@link #drain()} is
 * called the pool refuses new checkouts, lets in-flight handles finish, and closes every session
 * after the last one comes back.
 */
public final class TenantPool {

    private static final Logger log = LoggerFactory.getLogger(TenantPool.class);

    /** The pool was drained while the caller was trying to check out of it. */
    static final class PoolClosedException extends RuntimeException {
        PoolClosedException(String tenantId) {
            super("Pool for tenant '" + tenantId + "' is draining", null, false, false);
        }
    }

    private final String tenantId;
    private final String storeName;
    private final StoreConnector connector;
    private final PoolSettings settings;
    private final Clock clock;
    private final Semaphore permits;
    private final CompletableFuture<Void> drained = new CompletableFuture<>();
    private final AtomicLong opened = new AtomicLong();
    private final AtomicLong closed = new AtomicLong();

    // guarded by this
    private final Deque<StoreSession> idle = new ArrayDeque<>();
    private int checkedOut;
    private boolean draining;

    private volatile Instant lastUsedAt;

    TenantPool(String tenantId, String storeName, StoreConnector connector, PoolSettings settings, Clock clock,
               Semaphore permits) {
        this.tenantId = tenantId;
        this.storeName = storeName;
        this.connector = connector;
        this.settings = settings;
        this.clock = clock;
        this.permits = permits;
        this.lastUsedAt = clock.instant();
    }

    /**
     * Checks out a session, reusing an idle one when it is still valid.
     *
     * @throws PoolExhaustedException        no slot freed up within the acquire timeout
     * @throws StoreUnavailableException     every open attempt failed
     * @throws AcquisitionCancelledException the thread was interrupted while waiting
     * @throws PoolClosedException           the pool is draining
     */
    StoreHandle acquire() {
        if (isDraining()) {
            throw new PoolClosedException(tenantId);
        }
        Duration timeout = settings.acquireTimeout();
        boolean acquired;
        try {
            acquired = permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionCancelledException(tenantId, e);
        }
        if (!acquired) {
            throw new PoolExhaustedException(tenantId, timeout);
        }

        synchronized (this) {
            if (draining) {
                permits.release();
                throw new PoolClosedException(tenantId);
            }
            checkedOut++;
        }
        lastUsedAt = clock.instant();

        try {
            StoreSession session = takeIdle();
            if (session == null) {
                session = openWithRetry();
            }
            return new StoreHandle(tenantId, this, session);
        } catch (RuntimeException e) {
            giveBackSlot();
            throw e;
        }
    }

    /**
     * Returns a session from a released handle. Broken sessions, and every session once the pool
     * is draining, are closed instead of kept.
     */
    void release(StoreSession session, boolean broken) {
        boolean keep;
        synchronized (this) {
            keep = !draining && !broken;
            if (keep) {
                idle.push(session);
            }
        }
        if (!keep) {
            closeSession(session);
        }
        lastUsedAt = clock.instant();
        giveBackSlot();
    }

    /**
     * Stops new checkouts. The returned future completes once every in-flight handle has been
     * released and all sessions are closed. Calling it again returns the same future.
     */
    CompletableFuture<Void> drain() {
        boolean idleNow;
        synchronized (this) {
            draining = true;
            idleNow = checkedOut == 0;
        }
        if (idleNow) {
            finishDrain();
        }
        return drained;
    }

    private void giveBackSlot() {
        boolean finish;
        synchronized (this) {
            checkedOut--;
            finish = draining && checkedOut == 0;
        }
        permits.release();
        if (finish) {
            finishDrain();
        }
    }

    private void finishDrain() {
        List<StoreSession> toClose;
        synchronized (this) {
            toClose = new ArrayList<>(idle);
            idle.clear();
        }
        toClose.forEach(this::closeSession);
        if (drained.complete(null)) {
            log.debug("Pool for tenant '{}' drained ({} sessions opened, {} closed)",
                    tenantId, opened.get(), closed.get());
        }
    }

    private StoreSession takeIdle() {
        while (true) {
            StoreSession session;
            synchronized (this) {
                session = idle.poll();
            }
            if (session == null) {
                return null;
            }
            if (isValid(session)) {
                return session;
            }
            log.debug("Discarding invalid idle session for tenant '{}'", tenantId);
            closeSession(session);
        }
    }

    private StoreSession openWithRetry() {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= settings.openAttempts(); attempt++) {
            try {
                StoreSession session = connector.open(storeName);
                opened.incrementAndGet();
                return session;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Opening store '{}' for tenant '{}' failed (attempt {}/{}): {}",
                        storeName, tenantId, attempt, settings.openAttempts(), e.getMessage());
                if (attempt < settings.openAttempts()) {
                    backOff(settings.openBackoff().delayAfter(attempt));
                }
            }
        }
        throw new StoreUnavailableException(tenantId, lastFailure);
    }

    private void backOff(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionCancelledException(tenantId, e);
        }
    }

    private boolean isValid(StoreSession session) {
        try {
            return session.isValid();
        } catch (RuntimeException e) {
            log.debug("Validity check failed for tenant '{}': {}", tenantId, e.getMessage());
            return false;
        }
    }

    private void closeSession(StoreSession session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Closing session for tenant '{}' failed: {}", tenantId, e.getMessage());
        } finally {
            closed.incrementAndGet();
        }
    }

    public String tenantId() {
        return tenantId;
    }

    public String storeName() {
        return storeName;
    }

    public synchronized int checkedOut() {
        return checkedOut;
    }

    public synchronized int idleCount() {
        return idle.size();
    }

    public synchronized boolean isDraining() {
        return draining;
    }

    public boolean isDrained() {
        return drained.isDone();
    }

    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    public synchronized PoolStats stats() {
        return new PoolStats(tenantId, storeName, settings.maxSize(), checkedOut, idle.size(),
                opened.get(), closed.get(), lastUsedAt, draining);
    }
}
