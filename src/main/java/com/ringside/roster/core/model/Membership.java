package com.ringside.roster.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Join row between a group (tag team, stable, manager) and one member.
 * A null {@code leftAt} marks the membership as current.
 */
public record Membership(
        String id,
        MembershipKind kind,
        EntityRef group,
        EntityRef member,
        Instant joinedAt,
        Instant leftAt
) {
    public Membership {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(member, "member is required");
        Objects.requireNonNull(joinedAt, "joinedAt is required");
        if (group.type() != kind.groupType()) {
            throw new IllegalArgumentException(kind + " group must be a " + kind.groupType() + ", got " + group.type());
        }
        if (!kind.accepts(member.type())) {
            throw new IllegalArgumentException(kind + " does not accept a " + member.type());
        }
    }

    public boolean isCurrent() {
        return leftAt == null;
    }

    public boolean involves(EntityRef ref) {
        return group.equals(ref) || member.equals(ref);
    }

    public Membership withLeftAt(Instant leftAt) {
        return new Membership(id, kind, group, member, joinedAt, leftAt);
    }
}
