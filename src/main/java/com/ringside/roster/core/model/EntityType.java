package com.ringside.roster.core.model;

/**
 * Kinds of entities managed by the roster library.
 * The lock rank orders per-entity locks so that cascades always acquire
 * locks in the same direction (tag team, then wrestler, then manager).
 */
public enum EntityType {
    TITLE("Title", 0),
    STABLE("Stable", 1),
    TAG_TEAM("Tag Team", 2),
    WRESTLER("Wrestler", 3),
    MANAGER("Manager", 4),
    REFEREE("Referee", 5);

    private final String label;
    private final int lockRank;

    EntityType(String label, int lockRank) {
        this.label = label;
        this.lockRank = lockRank;
    }

    public String getLabel() {
        return label;
    }

    public int getLockRank() {
        return lockRank;
    }

    /**
     * Wrestlers, referees, managers and tag teams move through the employment lifecycle.
     */
    public boolean isRosterMember() {
        return this == WRESTLER || this == REFEREE || this == MANAGER || this == TAG_TEAM;
    }

    public boolean canBeInjured() {
        return this == WRESTLER || this == REFEREE || this == MANAGER;
    }

    public boolean canHoldTitles() {
        return this == WRESTLER || this == TAG_TEAM;
    }

    public boolean canBeManaged() {
        return this == WRESTLER || this == TAG_TEAM;
    }
}
