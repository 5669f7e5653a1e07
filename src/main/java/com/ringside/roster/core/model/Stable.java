package com.ringside.roster.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A stable: a named group of wrestlers, tag teams and managers. Its status is
 * derived from activation and retirement periods like a title's.
 */
public record Stable(String id, String name, StableStatus status, Instant createdAt, Instant deletedAt) {

    public Stable {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public static Stable create(String name, Instant createdAt) {
        return new Stable(UUID.randomUUID().toString(), name, StableStatus.UNACTIVATED, createdAt, null);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public Stable withStatus(StableStatus status) {
        return new Stable(id, name, status, createdAt, deletedAt);
    }

    public Stable withDeletedAt(Instant deletedAt) {
        return new Stable(id, name, status, createdAt, deletedAt);
    }

    public EntityRef ref() {
        return EntityRef.stable(id);
    }
}
