package com.ringside.roster.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Typed reference to a roster entity: a discriminant plus the entity id.
 * Used wherever a relationship may point at more than one entity type,
 * such as a champion (wrestler or tag team) or a stable member.
 */
public record EntityRef(EntityType type, String id) {

    public static final Comparator<EntityRef> LOCK_ORDER =
            Comparator.comparingInt((EntityRef ref) -> ref.type().getLockRank())
                    .thenComparing(EntityRef::id);

    public EntityRef {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(id, "id is required");
    }

    public static EntityRef of(EntityType type, String id) {
        return new EntityRef(type, id);
    }

    public static EntityRef wrestler(String id) {
        return new EntityRef(EntityType.WRESTLER, id);
    }

    public static EntityRef tagTeam(String id) {
        return new EntityRef(EntityType.TAG_TEAM, id);
    }

    public static EntityRef manager(String id) {
        return new EntityRef(EntityType.MANAGER, id);
    }

    public static EntityRef referee(String id) {
        return new EntityRef(EntityType.REFEREE, id);
    }

    public static EntityRef title(String id) {
        return new EntityRef(EntityType.TITLE, id);
    }

    public static EntityRef stable(String id) {
        return new EntityRef(EntityType.STABLE, id);
    }

    /**
     * Key used for per-entity locking and log correlation.
     */
    public String key() {
        return type.name() + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
