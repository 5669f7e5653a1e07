package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.transition.TransitionContext;
import com.ringside.roster.transition.TransitionEngine;
import com.ringside.roster.transition.TransitionTransaction;

import java.time.Instant;

/**
 * The applied transition a cascade reacts to, plus the unit of work its own
 * writes join.
 *
 * @param engine        engine for nested transitions on related entities
 * @param unit          unit of work of the primary transition
 * @param subject       entity the primary transition was applied to
 * @param transition    the primary transition
 * @param effectiveDate date cascade writes take effect
 * @param now           current time from the injected clock
 */
public record CascadeContext(
        TransitionEngine engine,
        TransitionContext unit,
        EntityRef subject,
        Transition transition,
        Instant effectiveDate,
        Instant now
) {
    public TransitionTransaction transaction() {
        return unit.transaction();
    }
}
