package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.ledger.PeriodLedger;
import com.ringside.roster.repository.RosterRepository;

import java.util.List;
import java.util.Set;

/**
 * Employing a tag team employs its current partners who are not yet employed.
 */
public class PartnerEmploymentCascade extends AbstractEmploymentCascade {

    private final RosterRepository repository;

    public PartnerEmploymentCascade(RosterRepository repository, PeriodLedger ledger) {
        super(ledger);
        this.repository = repository;
    }

    @Override
    public String name() {
        return "partner-employment";
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.TAG_TEAM);
    }

    @Override
    protected List<EntityRef> followers(CascadeContext context) {
        return repository.openMembershipsOfGroup(MembershipKind.TAG_TEAM_PARTNER, context.subject()).stream()
                .map(Membership::member)
                .toList();
    }
}
