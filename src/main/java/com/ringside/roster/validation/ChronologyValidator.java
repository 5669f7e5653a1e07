package com.ringside.roster.validation;

import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.transition.CannotTransitionException;

import java.util.List;
import java.util.Optional;

/**
 * Rejects effective dates that would produce an invalid period history:
 * ending a period at or before its start, starting a period inside one
 * that already ended, or dating a status change outside the employment it
 * belongs to.
 */
public class ChronologyValidator implements TransitionValidator {

    @Override
    public void validate(ValidationContext context) {
        Transition transition = context.transition();

        for (PeriodKind kind : transition.closes()) {
            Optional<Period> open = context.history().current(kind);
            if (open.isPresent() && !context.effectiveDate().isAfter(open.get().startedAt())) {
                throw reject(context, "effective date " + context.effectiveDate()
                        + " must be after the " + kind.name().toLowerCase() + " start " + open.get().startedAt());
            }
        }

        for (PeriodKind kind : transition.opens()) {
            Optional<Period> previous = context.history().latestClosed(kind);
            if (previous.isPresent() && context.effectiveDate().isBefore(previous.get().endedAt())) {
                throw reject(context, "effective date " + context.effectiveDate()
                        + " precedes the end of the previous " + kind.name().toLowerCase()
                        + " " + previous.get().endedAt());
            }
        }

        if (transition == Transition.SUSPEND || transition == Transition.INJURE) {
            Optional<Period> employment = context.history().current(PeriodKind.EMPLOYMENT);
            if (employment.isPresent() && context.effectiveDate().isBefore(employment.get().startedAt())) {
                throw reject(context, "effective date " + context.effectiveDate()
                        + " precedes the employment start " + employment.get().startedAt());
            }
        }

        if (transition == Transition.RETIRE) {
            for (PeriodKind kind : List.of(PeriodKind.EMPLOYMENT, PeriodKind.ACTIVATION)) {
                if (context.history().current(kind).isPresent()) {
                    continue;
                }
                Optional<Period> ended = context.history().latestClosed(kind);
                if (ended.isPresent() && context.effectiveDate().isBefore(ended.get().endedAt())) {
                    throw reject(context, "effective date " + context.effectiveDate()
                            + " precedes the end of the last " + kind.name().toLowerCase()
                            + " " + ended.get().endedAt());
                }
            }
        }

        if (transition == Transition.EMPLOY || transition == Transition.ACTIVATE) {
            Optional<Period> retirement = context.history().latestClosed(PeriodKind.RETIREMENT);
            if (retirement.isPresent() && context.effectiveDate().isBefore(retirement.get().endedAt())) {
                throw reject(context, "effective date " + context.effectiveDate()
                        + " precedes the end of retirement " + retirement.get().endedAt());
            }
        }
    }

    private CannotTransitionException reject(ValidationContext context, String reason) {
        return new CannotTransitionException(context.transition(), context.subject(),
                context.currentStatus().name(), reason);
    }
}
