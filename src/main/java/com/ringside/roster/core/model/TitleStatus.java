package com.ringside.roster.core.model;

/**
 * Status of a title, derived from its activation and retirement periods.
 */
public enum TitleStatus {
    UNACTIVATED("Unactivated"),
    PENDING_ACTIVATION("Pending Activation"),
    ACTIVE("Active"),
    INACTIVE("Inactive"),
    RETIRED("Retired");

    private final String label;

    TitleStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
