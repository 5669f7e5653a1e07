package com.ringside.roster.core.model;

/**
 * Validation family of an entity. Transition rules are looked up per
 * (family, transition) pair.
 */
public enum EntityFamily {
    INDIVIDUAL,
    TAG_TEAM,
    TITLE,
    STABLE;

    public static EntityFamily of(EntityType type) {
        return switch (type) {
            case WRESTLER, REFEREE, MANAGER -> INDIVIDUAL;
            case TAG_TEAM -> TAG_TEAM;
            case TITLE -> TITLE;
            case STABLE -> STABLE;
        };
    }
}
