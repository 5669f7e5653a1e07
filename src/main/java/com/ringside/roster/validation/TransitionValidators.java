package com.ringside.roster.validation;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityFamily;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.core.model.TitleStatus;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.ledger.PeriodLedger;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.status.StatusProjector;
import com.ringside.roster.transition.CannotTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatch table of validators keyed by (entity family, transition).
 *
 * <p>A pair with no entry is not supported for that family and is rejected.
 * Registered validators run in registration order; the legal-source check is
 * always registered first so the most basic rejection wins.</p>
 */
public class TransitionValidators {
    private static final Logger log = LoggerFactory.getLogger(TransitionValidators.class);

    private final Map<EntityFamily, Map<Transition, List<TransitionValidator>>> table =
            new EnumMap<>(EntityFamily.class);

    /**
     * Builds the standard rule set for wrestlers, referees, managers, tag teams, titles and stables.
     *
     * @param requiredTagTeamPartners partners a tag team needs before it can be employed
     */
    public static TransitionValidators defaults(int requiredTagTeamPartners, RosterRepository repository,
                                                PeriodLedger ledger, StatusProjector projector) {
        TransitionValidators validators = new TransitionValidators();
        ChronologyValidator chronology = new ChronologyValidator();
        DepartureValidator departure = new DepartureValidator(repository);

        for (EntityFamily family : List.of(EntityFamily.INDIVIDUAL, EntityFamily.TAG_TEAM)) {
            validators.register(family, Transition.EMPLOY,
                    LegalStatusValidator.from(EmploymentStatus.UNEMPLOYED, EmploymentStatus.RELEASED,
                            EmploymentStatus.FUTURE_EMPLOYED), chronology);
            validators.register(family, Transition.RELEASE,
                    LegalStatusValidator.from(EmploymentStatus.EMPLOYED, EmploymentStatus.SUSPENDED), chronology,
                    departure);
            validators.register(family, Transition.SUSPEND,
                    LegalStatusValidator.from(EmploymentStatus.EMPLOYED), chronology);
            validators.register(family, Transition.REINSTATE,
                    LegalStatusValidator.from(EmploymentStatus.SUSPENDED), chronology);
            validators.register(family, Transition.RETIRE,
                    LegalStatusValidator.from(EmploymentStatus.EMPLOYED, EmploymentStatus.SUSPENDED,
                            EmploymentStatus.RELEASED), chronology, departure);
            validators.register(family, Transition.UNRETIRE,
                    LegalStatusValidator.from(EmploymentStatus.RETIRED), chronology);
        }

        validators.register(EntityFamily.INDIVIDUAL, Transition.INJURE,
                LegalStatusValidator.from(EmploymentStatus.EMPLOYED), chronology);
        validators.register(EntityFamily.INDIVIDUAL, Transition.CLEAR_INJURY,
                LegalStatusValidator.from(EmploymentStatus.INJURED), chronology);

        validators.register(EntityFamily.TAG_TEAM, Transition.EMPLOY,
                TagTeamPartnersValidator.fullTeam(requiredTagTeamPartners, repository));
        TagTeamPartnersValidator availablePartners =
                TagTeamPartnersValidator.availablePartners(repository, ledger, projector);
        validators.register(EntityFamily.TAG_TEAM, Transition.SUSPEND, availablePartners);
        validators.register(EntityFamily.TAG_TEAM, Transition.RETIRE, availablePartners);

        validators.register(EntityFamily.TITLE, Transition.ACTIVATE,
                LegalStatusValidator.from(TitleStatus.UNACTIVATED, TitleStatus.PENDING_ACTIVATION,
                        TitleStatus.INACTIVE), chronology);
        validators.register(EntityFamily.TITLE, Transition.DEACTIVATE,
                LegalStatusValidator.from(TitleStatus.ACTIVE), chronology);
        validators.register(EntityFamily.TITLE, Transition.RETIRE,
                LegalStatusValidator.from(TitleStatus.ACTIVE, TitleStatus.INACTIVE), chronology, departure);
        validators.register(EntityFamily.TITLE, Transition.UNRETIRE,
                LegalStatusValidator.from(TitleStatus.RETIRED), chronology);

        validators.register(EntityFamily.STABLE, Transition.ACTIVATE,
                LegalStatusValidator.from(StableStatus.UNACTIVATED, StableStatus.PENDING_DEBUT,
                        StableStatus.DISBANDED), chronology);
        validators.register(EntityFamily.STABLE, Transition.DEACTIVATE,
                LegalStatusValidator.from(StableStatus.ACTIVE), chronology, departure);
        validators.register(EntityFamily.STABLE, Transition.RETIRE,
                LegalStatusValidator.from(StableStatus.ACTIVE, StableStatus.DISBANDED), chronology, departure);
        validators.register(EntityFamily.STABLE, Transition.UNRETIRE,
                LegalStatusValidator.from(StableStatus.RETIRED), chronology);

        return validators;
    }

    /**
     * Appends validators to the (family, transition) entry, creating it if needed.
     */
    public TransitionValidators register(EntityFamily family, Transition transition,
                                         TransitionValidator... validators) {
        table.computeIfAbsent(family, f -> new EnumMap<>(Transition.class))
                .computeIfAbsent(transition, t -> new ArrayList<>())
                .addAll(List.of(validators));
        return this;
    }

    public boolean supports(EntityFamily family, Transition transition) {
        return !validatorsFor(family, transition).isEmpty();
    }

    public List<TransitionValidator> validatorsFor(EntityFamily family, Transition transition) {
        return Optional.ofNullable(table.get(family))
                .map(byTransition -> byTransition.get(transition))
                .map(Collections::unmodifiableList)
                .orElse(List.of());
    }

    /**
     * Runs every validator registered for the context's family and transition.
     *
     * @throws CannotTransitionException on the first rule the request breaks, or
     *                                   if the family does not support the transition
     */
    public void validate(ValidationContext context) {
        List<TransitionValidator> validators = validatorsFor(context.family(), context.transition());
        if (validators.isEmpty()) {
            throw CannotTransitionException.unsupported(
                    context.transition(), context.subject(), context.currentStatus());
        }
        for (TransitionValidator validator : validators) {
            validator.validate(context);
        }
        log.debug("validation.passed subject={} transition={} status={}",
                context.subject(), context.transition().getLabel(), context.currentStatus());
    }

    /**
     * Same checks as {@link #validate} answered as a boolean.
     */
    public boolean isAllowed(ValidationContext context) {
        try {
            validate(context);
            return true;
        } catch (CannotTransitionException e) {
            return false;
        }
    }
}
