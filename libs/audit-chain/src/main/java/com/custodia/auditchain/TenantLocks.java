package com.custodia.auditchain;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per tenant around the read-head, hash, append section. Appends for different tenants
 * never contend.
 */
public final class TenantLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public TenantLocks(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    /**
     * Runs {@code work} while holding the tenant's lock.
     *
     * @throws ChainBusyException if the lock is not acquired within the timeout, or the wait is
     *                            interrupted
     */
    public <T> T withLock(String tenantId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(tenantId, t -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainBusyException(tenantId, timeout, e);
        }
        if (!acquired) {
            throw new ChainBusyException(tenantId, timeout);
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public Duration timeout() {
        return timeout;
    }
}
