package com.ringside.roster.audit;

/**
 * Types of auditable actions in the roster lifecycle.
 */
public enum AuditAction {
    TRANSITION_APPLIED,
    TRANSITION_REJECTED,
    CASCADE_APPLIED,
    MEMBERSHIP_CHANGED,
    CHAMPIONSHIP_CHANGED,
    ENTITY_CREATED,
    ENTITY_DELETED,
    ENTITY_RESTORED
}
