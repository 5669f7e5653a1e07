package com.ringside.roster.core.model;

/**
 * Kinds of time-bounded periods kept in the period ledger.
 */
public enum PeriodKind {
    EMPLOYMENT,
    SUSPENSION,
    INJURY,
    RETIREMENT,
    ACTIVATION
}
