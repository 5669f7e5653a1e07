package com.ringside.roster.core.model;

/**
 * Status of a stable, derived from its activation and retirement periods.
 * A stable debuts when activated and is disbanded when deactivated.
 */
public enum StableStatus {
    UNACTIVATED("Unactivated"),
    PENDING_DEBUT("Pending Debut"),
    ACTIVE("Active"),
    DISBANDED("Disbanded"),
    RETIRED("Retired");

    private final String label;

    StableStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
