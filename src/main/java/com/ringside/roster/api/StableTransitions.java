package com.ringside.roster.api;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Stable;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.transition.TransitionEngine;

import java.time.Instant;

/**
 * Lifecycle transitions for stables. Disbanding or retiring a stable ends
 * every current membership in it on the same date.
 */
public class StableTransitions {

    private final TransitionEngine engine;

    StableTransitions(TransitionEngine engine) {
        this.engine = engine;
    }

    /**
     * Debuts the stable, or reunites a disbanded one.
     */
    public Stable activate(String id, Instant effectiveDate) {
        return engine.transitionStable(id, Transition.ACTIVATE, effectiveDate, null);
    }

    public Stable disband(String id, Instant effectiveDate) {
        return engine.transitionStable(id, Transition.DEACTIVATE, effectiveDate, null);
    }

    public Stable retire(String id, Instant effectiveDate) {
        return engine.transitionStable(id, Transition.RETIRE, effectiveDate, null);
    }

    public Stable unretire(String id, Instant effectiveDate) {
        return engine.transitionStable(id, Transition.UNRETIRE, effectiveDate, null);
    }

    public StableStatus status(String id) {
        return (StableStatus) engine.projectStatus(EntityRef.stable(id));
    }

    public boolean canTransition(String id, Transition transition) {
        return engine.canTransition(EntityRef.stable(id), transition, null);
    }
}
