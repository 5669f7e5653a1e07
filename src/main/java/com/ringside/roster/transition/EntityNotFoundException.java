package com.ringside.roster.transition;

import com.ringside.roster.core.RosterException;
import com.ringside.roster.core.model.EntityRef;

/**
 * Raised when a referenced entity, membership or championship does not exist.
 * Deleted entities are reported as not found.
 */
public class EntityNotFoundException extends RosterException {

    private final EntityRef ref;

    public EntityNotFoundException(EntityRef ref, String message) {
        super(message);
        this.ref = ref;
    }

    public static EntityNotFoundException entity(EntityRef ref) {
        return new EntityNotFoundException(ref, ref.type().getLabel() + " not found: " + ref.id());
    }

    public static EntityNotFoundException membership(EntityRef group, EntityRef member) {
        return new EntityNotFoundException(member,
                "No current membership of " + member + " in " + group);
    }

    public static EntityNotFoundException championship(String titleId) {
        return new EntityNotFoundException(EntityRef.title(titleId),
                "Title '" + titleId + "' has no current champion");
    }

    public EntityRef getRef() {
        return ref;
    }
}
