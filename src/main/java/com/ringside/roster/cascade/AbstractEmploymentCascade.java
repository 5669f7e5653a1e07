package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.ledger.PeriodLedger;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base for cascades that employ related members alongside the subject.
 * Each related member goes through the full employ transition, nested in the
 * subject's unit of work.
 */
abstract class AbstractEmploymentCascade implements CascadeStrategy {

    private final PeriodLedger ledger;

    protected AbstractEmploymentCascade(PeriodLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Set<Transition> triggers() {
        return Set.of(Transition.EMPLOY);
    }

    /**
     * Members that should be employed together with the subject.
     */
    protected abstract List<EntityRef> followers(CascadeContext context);

    @Override
    public int apply(CascadeContext context) {
        int employed = 0;
        for (EntityRef follower : followers(context)) {
            if (needsEmployment(context, follower)) {
                context.engine().transitionMember(follower, Transition.EMPLOY, context.effectiveDate(), null);
                employed++;
            }
        }
        return employed;
    }

    // future employment is only brought forward, never pushed back
    private boolean needsEmployment(CascadeContext context, EntityRef follower) {
        EmploymentStatus status = context.engine().projectMember(follower);
        if (status == EmploymentStatus.UNEMPLOYED || status == EmploymentStatus.RELEASED) {
            return true;
        }
        if (status == EmploymentStatus.FUTURE_EMPLOYED) {
            Optional<Period> scheduled = ledger.history(follower).current(PeriodKind.EMPLOYMENT);
            return scheduled.isPresent() && scheduled.get().startedAt().isAfter(context.effectiveDate());
        }
        return false;
    }
}
