package com.ringside.roster.validation;

import com.ringside.roster.core.model.EntityFamily;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.PeriodHistory;
import com.ringside.roster.core.model.Transition;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything a validator needs to approve or reject one transition request.
 *
 * @param subject       entity being transitioned
 * @param transition    requested transition
 * @param currentStatus status projected from {@code history} at {@code now}
 * @param history       the subject's full period history
 * @param effectiveDate date the transition takes effect
 * @param now           current time from the injected clock
 */
public record ValidationContext(
        EntityRef subject,
        Transition transition,
        Enum<?> currentStatus,
        PeriodHistory history,
        Instant effectiveDate,
        Instant now
) {
    public ValidationContext {
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(transition, "transition is required");
        Objects.requireNonNull(currentStatus, "currentStatus is required");
        Objects.requireNonNull(history, "history is required");
        Objects.requireNonNull(effectiveDate, "effectiveDate is required");
        Objects.requireNonNull(now, "now is required");
    }

    public EntityFamily family() {
        return EntityFamily.of(subject.type());
    }
}
