package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.membership.MembershipWriter;
import com.ringside.roster.repository.RosterRepository;

import java.util.List;
import java.util.Set;

/**
 * Ends manager assignments when either side departs: a departing manager stops
 * managing all clients, a departing client loses all managers.
 */
public class ManagementCascade implements CascadeStrategy {

    private final RosterRepository repository;
    private final MembershipWriter membershipWriter;

    public ManagementCascade(RosterRepository repository, MembershipWriter membershipWriter) {
        this.repository = repository;
        this.membershipWriter = membershipWriter;
    }

    @Override
    public String name() {
        return "management-ended";
    }

    @Override
    public Set<Transition> triggers() {
        return Set.of(Transition.RELEASE, Transition.RETIRE);
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.MANAGER, EntityType.WRESTLER, EntityType.TAG_TEAM);
    }

    @Override
    public int apply(CascadeContext context) {
        List<Membership> open = context.subject().type() == EntityType.MANAGER
                ? repository.openMembershipsOfGroup(MembershipKind.MANAGEMENT, context.subject())
                : repository.openMembershipsOfMember(MembershipKind.MANAGEMENT, context.subject());
        open.forEach(membership -> membershipWriter.end(context.transaction(), membership, context.effectiveDate()));
        return open.size();
    }
}
