package com.ringside.roster.lock;

import com.ringside.roster.core.model.EntityRef;

/**
 * Serializes read-validate-write sequences on one roster entity. A unit of
 * work acquires the lock of every entity it may touch before reading any of
 * them, in {@link EntityRef#LOCK_ORDER}.
 *
 * <p>Implementations must be re-entrant for the holding thread.</p>
 */
public interface EntityLock {

    /**
     * Blocks until the calling thread holds the entity's lock.
     *
     * @throws LockAcquisitionException if the lock is not granted in time
     */
    void acquire(EntityRef entity);

    /**
     * Releases one hold of the entity's lock. Does nothing if the calling
     * thread does not hold it.
     */
    void release(EntityRef entity);
}
