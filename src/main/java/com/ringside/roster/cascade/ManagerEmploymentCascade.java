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
 * Employing a wrestler or tag team employs its current managers who are not yet employed.
 */
public class ManagerEmploymentCascade extends AbstractEmploymentCascade {

    private final RosterRepository repository;

    public ManagerEmploymentCascade(RosterRepository repository, PeriodLedger ledger) {
        super(ledger);
        this.repository = repository;
    }

    @Override
    public String name() {
        return "manager-employment";
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.WRESTLER, EntityType.TAG_TEAM);
    }

    @Override
    protected List<EntityRef> followers(CascadeContext context) {
        return repository.openMembershipsOfMember(MembershipKind.MANAGEMENT, context.subject()).stream()
                .map(Membership::group)
                .toList();
    }
}
