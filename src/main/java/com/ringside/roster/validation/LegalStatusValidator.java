package com.ringside.roster.validation;

import com.ringside.roster.transition.CannotTransitionException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * Accepts a transition only from the listed source statuses.
 */
public class LegalStatusValidator implements TransitionValidator {

    private final Set<Enum<?>> legalSources;

    private LegalStatusValidator(Collection<? extends Enum<?>> legalSources) {
        this.legalSources = Set.copyOf(legalSources);
    }

    @SafeVarargs
    public static <S extends Enum<S>> LegalStatusValidator from(S... statuses) {
        return new LegalStatusValidator(Arrays.asList(statuses));
    }

    public Set<Enum<?>> getLegalSources() {
        return legalSources;
    }

    public boolean allows(Enum<?> status) {
        return legalSources.contains(status);
    }

    @Override
    public void validate(ValidationContext context) {
        if (!allows(context.currentStatus())) {
            throw CannotTransitionException.illegalStatus(
                    context.transition(), context.subject(), context.currentStatus());
        }
    }
}
