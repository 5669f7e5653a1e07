package com.ringside.roster.transition;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Transition;

import java.time.Instant;

/**
 * Result of one applied transition: the status before and after and the date it took effect.
 */
public record TransitionOutcome(
        EntityRef subject,
        Transition transition,
        Enum<?> from,
        Enum<?> to,
        Instant effectiveDate,
        int cascadedChanges
) {
}
