package com.ringside.roster.transition;

import com.ringside.roster.core.RosterException;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Transition;

/**
 * Raised when a transition is not legal from the entity's current status,
 * or when a family-specific rule rejects it.
 */
public class CannotTransitionException extends RosterException {

    private final Transition transition;
    private final EntityRef subject;
    private final String currentStatus;

    public CannotTransitionException(Transition transition, EntityRef subject, String currentStatus, String reason) {
        super("Cannot " + transition.getLabel() + " " + subject.type().getLabel() + " '" + subject.id()
                + "' with status " + currentStatus + ": " + reason);
        this.transition = transition;
        this.subject = subject;
        this.currentStatus = currentStatus;
    }

    public static CannotTransitionException illegalStatus(Transition transition, EntityRef subject,
                                                          Enum<?> currentStatus) {
        return new CannotTransitionException(transition, subject, currentStatus.name(),
                "not allowed from " + currentStatus.name());
    }

    public static CannotTransitionException unsupported(Transition transition, EntityRef subject,
                                                        Enum<?> currentStatus) {
        return new CannotTransitionException(transition, subject, currentStatus.name(),
                "a " + subject.type().getLabel() + " does not support this transition");
    }

    public Transition getTransition() {
        return transition;
    }

    public EntityRef getSubject() {
        return subject;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
