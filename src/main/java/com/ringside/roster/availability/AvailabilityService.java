package com.ringside.roster.availability;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.TitleStatus;
import com.ringside.roster.ledger.PeriodLedger;
import com.ringside.roster.repository.RosterLookup;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.status.StatusProjector;

import java.time.Clock;
import java.util.List;

/**
 * Read-time booking eligibility. Nothing here is stored: eligibility is
 * recomputed from period history and current memberships on every call.
 *
 * <p>Suspended and injured members keep their titles and team places but
 * are never counted as available.</p>
 */
public class AvailabilityService {

    private final RosterRepository repository;
    private final RosterLookup lookup;
    private final PeriodLedger ledger;
    private final StatusProjector projector;
    private final Clock clock;
    private final int requiredTagTeamPartners;

    public AvailabilityService(RosterRepository repository, PeriodLedger ledger, StatusProjector projector,
                               Clock clock, int requiredTagTeamPartners) {
        this.repository = repository;
        this.lookup = new RosterLookup(repository);
        this.ledger = ledger;
        this.projector = projector;
        this.clock = clock;
        this.requiredTagTeamPartners = requiredTagTeamPartners;
    }

    /**
     * Whether a member can be booked right now. A tag team also needs the
     * required number of current partners, each of them bookable.
     */
    public boolean isBookable(EntityRef ref) {
        if (!ref.type().isRosterMember() || !lookup.exists(ref)) {
            return false;
        }
        if (status(ref) != EmploymentStatus.EMPLOYED) {
            return false;
        }
        if (ref.type() == EntityType.TAG_TEAM) {
            return activePartnerCount(ref.id()) >= requiredTagTeamPartners;
        }
        return true;
    }

    /**
     * Current partners of the tag team that are themselves bookable.
     */
    public int activePartnerCount(String tagTeamId) {
        return (int) repository.openMembershipsOfGroup(MembershipKind.TAG_TEAM_PARTNER, EntityRef.tagTeam(tagTeamId))
                .stream()
                .map(Membership::member)
                .filter(this::isBookable)
                .count();
    }

    /**
     * Bookable members of one type, by name.
     */
    public List<RosterMember> availableMembers(EntityType type) {
        return repository.findMembersByType(type).stream()
                .filter(member -> !member.isDeleted())
                .filter(member -> isBookable(member.ref()))
                .toList();
    }

    /**
     * Whether the title is active right now, as projected from its activation periods.
     */
    public boolean isTitleActive(String titleId) {
        return projector.projectTitle(ledger.history(EntityRef.title(titleId)), clock.instant()) == TitleStatus.ACTIVE;
    }

    public int getRequiredTagTeamPartners() {
        return requiredTagTeamPartners;
    }

    private EmploymentStatus status(EntityRef ref) {
        return projector.project(ledger.history(ref), clock.instant());
    }
}
