package com.ringside.roster.status;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodHistory;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.core.model.TitleStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Derives the current status of an entity from its period history.
 *
 * <p>All projections are pure: the same history and the same {@code now}
 * always give the same status. Checks are evaluated in order and the first
 * match wins.</p>
 */
public class StatusProjector {

    /**
     * Projects the employment status of a wrestler, referee, manager or tag team.
     * <ol>
     *   <li>open retirement: {@link EmploymentStatus#RETIRED}</li>
     *   <li>no employment, or the latest employment predates the last ended retirement:
     *       {@link EmploymentStatus#UNEMPLOYED}</li>
     *   <li>latest employment starts after {@code now}: {@link EmploymentStatus#FUTURE_EMPLOYED}</li>
     *   <li>latest employment closed: {@link EmploymentStatus#RELEASED}</li>
     *   <li>open injury: {@link EmploymentStatus#INJURED}; open suspension:
     *       {@link EmploymentStatus#SUSPENDED}; otherwise {@link EmploymentStatus#EMPLOYED}</li>
     * </ol>
     */
    public EmploymentStatus project(PeriodHistory history, Instant now) {
        if (history.current(PeriodKind.RETIREMENT).isPresent()) {
            return EmploymentStatus.RETIRED;
        }

        Optional<Period> latestEmployment = history.latest(PeriodKind.EMPLOYMENT);
        if (latestEmployment.isEmpty()) {
            return EmploymentStatus.UNEMPLOYED;
        }
        Period employment = latestEmployment.get();
        if (employment.isClosed() && predatesLastRetirement(history, employment)) {
            return EmploymentStatus.UNEMPLOYED;
        }

        if (employment.startedAt().isAfter(now)) {
            return EmploymentStatus.FUTURE_EMPLOYED;
        }
        if (employment.isClosed()) {
            return EmploymentStatus.RELEASED;
        }

        if (history.current(PeriodKind.INJURY).isPresent()) {
            return EmploymentStatus.INJURED;
        }
        if (history.current(PeriodKind.SUSPENSION).isPresent()) {
            return EmploymentStatus.SUSPENDED;
        }
        return EmploymentStatus.EMPLOYED;
    }

    /**
     * Projects the status of a title from its activation and retirement periods.
     */
    public TitleStatus projectTitle(PeriodHistory history, Instant now) {
        if (history.current(PeriodKind.RETIREMENT).isPresent()) {
            return TitleStatus.RETIRED;
        }

        Optional<Period> latestActivation = history.latest(PeriodKind.ACTIVATION);
        if (latestActivation.isEmpty()) {
            return TitleStatus.UNACTIVATED;
        }
        Period activation = latestActivation.get();
        if (activation.startedAt().isAfter(now)) {
            return TitleStatus.PENDING_ACTIVATION;
        }
        return activation.isClosed() ? TitleStatus.INACTIVE : TitleStatus.ACTIVE;
    }

    /**
     * Projects the status of a stable. Same order as a title: an activation is
     * the stable's debut and its end is the stable being disbanded.
     */
    public StableStatus projectStable(PeriodHistory history, Instant now) {
        if (history.current(PeriodKind.RETIREMENT).isPresent()) {
            return StableStatus.RETIRED;
        }

        Optional<Period> latestActivation = history.latest(PeriodKind.ACTIVATION);
        if (latestActivation.isEmpty()) {
            return StableStatus.UNACTIVATED;
        }
        Period activation = latestActivation.get();
        if (activation.startedAt().isAfter(now)) {
            return StableStatus.PENDING_DEBUT;
        }
        return activation.isClosed() ? StableStatus.DISBANDED : StableStatus.ACTIVE;
    }

    // an employment that ended with a retirement which was itself later ended
    private boolean predatesLastRetirement(PeriodHistory history, Period employment) {
        return history.latestClosed(PeriodKind.RETIREMENT)
                .map(retirement -> !employment.startedAt().isAfter(retirement.startedAt()))
                .orElse(false);
    }
}
