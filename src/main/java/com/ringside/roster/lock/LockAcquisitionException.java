package com.ringside.roster.lock;

import com.ringside.roster.core.RosterException;
import com.ringside.roster.core.model.EntityRef;

import java.time.Duration;

/**
 * Raised when a unit of work cannot obtain the lock of an entity it needs.
 * The unit of work is rolled back and the request can be retried.
 */
public class LockAcquisitionException extends RosterException {

    private final EntityRef entity;

    private LockAcquisitionException(EntityRef entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    public static LockAcquisitionException timedOut(EntityRef entity, Duration timeout) {
        return new LockAcquisitionException(entity,
                "Timed out after " + timeout.toMillis() + "ms waiting for the lock on " + entity, null);
    }

    public static LockAcquisitionException interrupted(EntityRef entity, InterruptedException cause) {
        return new LockAcquisitionException(entity, "Interrupted while waiting for the lock on " + entity, cause);
    }

    /**
     * {@code entity} became related to the unit of work after its locks were taken, on every attempt.
     */
    public static LockAcquisitionException unsettled(EntityRef entity, int attempts) {
        return new LockAcquisitionException(entity, "Entities to lock kept changing, " + entity
                + " was still unlocked after " + attempts + " attempts", null);
    }

    public EntityRef getEntity() {
        return entity;
    }
}
