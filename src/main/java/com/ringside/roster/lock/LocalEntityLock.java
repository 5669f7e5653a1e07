package com.ringside.roster.lock;

import com.ringside.roster.core.model.EntityRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process entity lock backed by one {@link ReentrantLock} per entity.
 * This is the default lock for single-JVM deployments.
 *
 * <p>A lock is dropped from the table once it is released with no holder and
 * no waiter, so the table only tracks entities that are in use.</p>
 */
public class LocalEntityLock implements EntityLock {
    private static final Logger log = LoggerFactory.getLogger(LocalEntityLock.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final ConcurrentHashMap<EntityRef, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public LocalEntityLock() {
        this(DEFAULT_TIMEOUT);
    }

    public LocalEntityLock(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    @Override
    public void acquire(EntityRef entity) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(entity, e -> new ReentrantLock());
            boolean acquired;
            try {
                acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw LockAcquisitionException.interrupted(entity, e);
            }
            if (!acquired) {
                throw LockAcquisitionException.timedOut(entity, timeout);
            }
            // the lock may have been evicted between lookup and acquisition
            if (locks.get(entity) == lock) {
                log.debug("lock.acquired entity={} holds={}", entity, lock.getHoldCount());
                return;
            }
            lock.unlock();
        }
    }

    @Override
    public void release(EntityRef entity) {
        ReentrantLock lock = locks.get(entity);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            return;
        }
        lock.unlock();
        locks.computeIfPresent(entity, (e, l) -> l.hasQueuedThreads() || l.isLocked() ? l : null);
        log.debug("lock.released entity={}", entity);
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Number of entities with a live lock.
     */
    public int trackedEntities() {
        return locks.size();
    }
}
