package com.ringside.roster.validation;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.ledger.PeriodLedger;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.status.StatusProjector;
import com.ringside.roster.transition.CannotTransitionException;

import java.util.List;

/**
 * Tag-team rules that depend on the team's current partners.
 *
 * <ul>
 *   <li>{@link #fullTeam} - the team needs the required number of current partners
 *       (employment)</li>
 *   <li>{@link #availablePartners} - the team needs at least one current partner and
 *       none of them may be injured or suspended (suspension, retirement)</li>
 * </ul>
 */
public class TagTeamPartnersValidator implements TransitionValidator {

    private enum Rule { FULL_TEAM, AVAILABLE_PARTNERS }

    private final Rule rule;
    private final int requiredPartners;
    private final RosterRepository repository;
    private final PeriodLedger ledger;
    private final StatusProjector projector;

    private TagTeamPartnersValidator(Rule rule, int requiredPartners, RosterRepository repository,
                                     PeriodLedger ledger, StatusProjector projector) {
        this.rule = rule;
        this.requiredPartners = requiredPartners;
        this.repository = repository;
        this.ledger = ledger;
        this.projector = projector;
    }

    public static TagTeamPartnersValidator fullTeam(int requiredPartners, RosterRepository repository) {
        return new TagTeamPartnersValidator(Rule.FULL_TEAM, requiredPartners, repository, null, null);
    }

    public static TagTeamPartnersValidator availablePartners(RosterRepository repository, PeriodLedger ledger,
                                                             StatusProjector projector) {
        return new TagTeamPartnersValidator(Rule.AVAILABLE_PARTNERS, 0, repository, ledger, projector);
    }

    @Override
    public void validate(ValidationContext context) {
        List<EntityRef> partners = repository.openMembershipsOfGroup(MembershipKind.TAG_TEAM_PARTNER,
                        context.subject()).stream()
                .map(Membership::member)
                .toList();

        if (rule == Rule.FULL_TEAM) {
            if (partners.size() < requiredPartners) {
                throw reject(context, "tag team has " + partners.size() + " current partners, "
                        + requiredPartners + " required");
            }
            return;
        }

        if (partners.isEmpty()) {
            throw reject(context, "tag team has no current partners");
        }
        for (EntityRef partner : partners) {
            EmploymentStatus status = projector.project(ledger.history(partner), context.now());
            if (status == EmploymentStatus.INJURED || status == EmploymentStatus.SUSPENDED) {
                throw reject(context, "partner " + describe(partner) + " is " + status.getLabel().toLowerCase());
            }
        }
    }

    private String describe(EntityRef partner) {
        return repository.findMember(partner.id())
                .map(member -> "'" + member.getName() + "'")
                .orElse(partner.toString());
    }

    private CannotTransitionException reject(ValidationContext context, String reason) {
        return new CannotTransitionException(context.transition(), context.subject(),
                context.currentStatus().name(), reason);
    }
}
