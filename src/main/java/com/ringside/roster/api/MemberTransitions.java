package com.ringside.roster.api;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.transition.TransitionEngine;

import java.time.Instant;

/**
 * Lifecycle transitions for one kind of roster member (wrestlers, referees,
 * managers or tag teams). Each transition takes an optional effective date;
 * without one it takes effect now.
 *
 * <p>Every call returns the member with its refreshed status, or throws
 * {@link com.ringside.roster.transition.CannotTransitionException} or
 * {@link com.ringside.roster.transition.EntityNotFoundException}.</p>
 */
public class MemberTransitions {

    private final EntityType type;
    private final TransitionEngine engine;

    MemberTransitions(EntityType type, TransitionEngine engine) {
        this.type = type;
        this.engine = engine;
    }

    public EntityType getType() {
        return type;
    }

    public RosterMember employ(String id) {
        return employ(id, null);
    }

    public RosterMember employ(String id, Instant effectiveDate) {
        return apply(id, Transition.EMPLOY, effectiveDate, null);
    }

    public RosterMember release(String id) {
        return release(id, null);
    }

    public RosterMember release(String id, Instant effectiveDate) {
        return apply(id, Transition.RELEASE, effectiveDate, null);
    }

    public RosterMember suspend(String id) {
        return suspend(id, null);
    }

    public RosterMember suspend(String id, Instant effectiveDate) {
        return apply(id, Transition.SUSPEND, effectiveDate, null);
    }

    public RosterMember reinstate(String id) {
        return reinstate(id, null);
    }

    public RosterMember reinstate(String id, Instant effectiveDate) {
        return apply(id, Transition.REINSTATE, effectiveDate, null);
    }

    public RosterMember injure(String id) {
        return injure(id, null);
    }

    public RosterMember injure(String id, Instant effectiveDate) {
        return apply(id, Transition.INJURE, effectiveDate, null);
    }

    public RosterMember clearInjury(String id) {
        return clearInjury(id, null);
    }

    public RosterMember clearInjury(String id, Instant effectiveDate) {
        return apply(id, Transition.CLEAR_INJURY, effectiveDate, null);
    }

    public RosterMember retire(String id) {
        return retire(id, null, null);
    }

    public RosterMember retire(String id, Instant effectiveDate) {
        return retire(id, effectiveDate, null);
    }

    /**
     * Retires the member, keeping the notes on the retirement period.
     */
    public RosterMember retire(String id, Instant effectiveDate, String notes) {
        return apply(id, Transition.RETIRE, effectiveDate, notes);
    }

    public RosterMember unretire(String id) {
        return unretire(id, null);
    }

    public RosterMember unretire(String id, Instant effectiveDate) {
        return apply(id, Transition.UNRETIRE, effectiveDate, null);
    }

    /**
     * Current status projected from the member's periods.
     */
    public EmploymentStatus status(String id) {
        return (EmploymentStatus) engine.projectStatus(EntityRef.of(type, id));
    }

    /**
     * Whether the transition would be accepted now.
     */
    public boolean canTransition(String id, Transition transition) {
        return engine.canTransition(EntityRef.of(type, id), transition, null);
    }

    private RosterMember apply(String id, Transition transition, Instant effectiveDate, String notes) {
        return engine.transitionMember(EntityRef.of(type, id), transition, effectiveDate, notes);
    }
}
