package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Transition;

import java.util.Set;

/**
 * A consequence of a transition for related entities.
 */
public interface CascadeStrategy {

    /**
     * Name used in logs, metrics and audit details.
     */
    String name();

    Set<Transition> triggers();

    /**
     * Entity types whose transitions fire this cascade.
     */
    Set<EntityType> subjectTypes();

    /**
     * Applies the cascade.
     *
     * @return number of related rows or entities changed
     */
    int apply(CascadeContext context);

    default boolean appliesTo(EntityType type, Transition transition) {
        return triggers().contains(transition) && subjectTypes().contains(type);
    }
}
