package com.ringside.roster.validation;

import com.ringside.roster.transition.CannotTransitionException;

/**
 * One rule a transition must satisfy. Validators run before any write and
 * fail fast with {@link CannotTransitionException}.
 */
@FunctionalInterface
public interface TransitionValidator {

    /**
     * @throws CannotTransitionException if the request breaks this rule
     */
    void validate(ValidationContext context);
}
