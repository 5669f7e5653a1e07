package com.ringside.roster.core.model;

/**
 * Employment status of a roster member, always derived from its period history.
 */
public enum EmploymentStatus {
    UNEMPLOYED("Unemployed"),
    FUTURE_EMPLOYED("Future Employment"),
    EMPLOYED("Employed"),
    SUSPENDED("Suspended"),
    INJURED("Injured"),
    RELEASED("Released"),
    RETIRED("Retired");

    private final String label;

    EmploymentStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
