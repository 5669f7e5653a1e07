package com.ringside.roster.core.model;

import java.util.Set;

/**
 * Kinds of membership rows: which entity type is the group and which may join it.
 */
public enum MembershipKind {
    TAG_TEAM_PARTNER(EntityType.TAG_TEAM, Set.of(EntityType.WRESTLER)),
    STABLE_MEMBER(EntityType.STABLE, Set.of(EntityType.WRESTLER, EntityType.TAG_TEAM, EntityType.MANAGER)),
    MANAGEMENT(EntityType.MANAGER, Set.of(EntityType.WRESTLER, EntityType.TAG_TEAM));

    private final EntityType groupType;
    private final Set<EntityType> memberTypes;

    MembershipKind(EntityType groupType, Set<EntityType> memberTypes) {
        this.groupType = groupType;
        this.memberTypes = memberTypes;
    }

    public EntityType groupType() {
        return groupType;
    }

    public boolean accepts(EntityType memberType) {
        return memberTypes.contains(memberType);
    }
}
