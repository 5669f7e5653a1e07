package com.ringside.roster.repository;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.Stable;
import com.ringside.roster.core.model.Title;
import com.ringside.roster.transition.EntityNotFoundException;

/**
 * Resolves references to live entities. Deleted entities, and
 * references whose type does not match the stored entity, are not found.
 */
public class RosterLookup {

    private final RosterRepository repository;

    public RosterLookup(RosterRepository repository) {
        this.repository = repository;
    }

    public RosterMember member(EntityRef ref) {
        return repository.findMember(ref.id())
                .filter(member -> member.getType() == ref.type() && !member.isDeleted())
                .orElseThrow(() -> EntityNotFoundException.entity(ref));
    }

    public Title title(String titleId) {
        return repository.findTitle(titleId)
                .filter(title -> !title.isDeleted())
                .orElseThrow(() -> EntityNotFoundException.entity(EntityRef.title(titleId)));
    }

    public Stable stable(String stableId) {
        return repository.findStable(stableId)
                .filter(stable -> !stable.isDeleted())
                .orElseThrow(() -> EntityNotFoundException.entity(EntityRef.stable(stableId)));
    }

    /**
     * Whether the referenced entity exists and is not deleted.
     */
    public boolean exists(EntityRef ref) {
        return switch (ref.type()) {
            case TITLE -> repository.findTitle(ref.id()).filter(title -> !title.isDeleted()).isPresent();
            case STABLE -> repository.findStable(ref.id()).filter(stable -> !stable.isDeleted()).isPresent();
            default -> repository.findMember(ref.id())
                    .filter(member -> member.getType() == ref.type() && !member.isDeleted())
                    .isPresent();
        };
    }

    /**
     * Checks that the referenced entity exists, whatever its type.
     *
     * @return the same reference
     */
    public EntityRef require(EntityRef ref) {
        if (ref.type() == EntityType.TITLE) {
            title(ref.id());
        } else if (ref.type() == EntityType.STABLE) {
            stable(ref.id());
        } else {
            member(ref);
        }
        return ref;
    }
}
