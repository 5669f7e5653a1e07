package com.ringside.roster.api;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Title;
import com.ringside.roster.core.model.TitleStatus;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.transition.TransitionEngine;

import java.time.Instant;

/**
 * Lifecycle transitions for titles.
 */
public class TitleTransitions {

    private final TransitionEngine engine;

    TitleTransitions(TransitionEngine engine) {
        this.engine = engine;
    }

    public Title activate(String id) {
        return activate(id, null);
    }

    public Title activate(String id, Instant effectiveDate) {
        return engine.transitionTitle(id, Transition.ACTIVATE, effectiveDate, null);
    }

    public Title deactivate(String id) {
        return deactivate(id, null);
    }

    public Title deactivate(String id, Instant effectiveDate) {
        return engine.transitionTitle(id, Transition.DEACTIVATE, effectiveDate, null);
    }

    public Title retire(String id) {
        return retire(id, null);
    }

    /**
     * Retires the title; its current reign, if any, ends on the same date.
     */
    public Title retire(String id, Instant effectiveDate) {
        return engine.transitionTitle(id, Transition.RETIRE, effectiveDate, null);
    }

    public Title unretire(String id) {
        return unretire(id, null);
    }

    public Title unretire(String id, Instant effectiveDate) {
        return engine.transitionTitle(id, Transition.UNRETIRE, effectiveDate, null);
    }

    public TitleStatus status(String id) {
        return (TitleStatus) engine.projectStatus(EntityRef.title(id));
    }

    public boolean canTransition(String id, Transition transition) {
        return engine.canTransition(EntityRef.title(id), transition, null);
    }
}
