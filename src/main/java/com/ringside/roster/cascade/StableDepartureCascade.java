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
 * A stable member who is released or retires leaves the stable.
 */
public class StableDepartureCascade implements CascadeStrategy {

    private final RosterRepository repository;
    private final MembershipWriter membershipWriter;

    public StableDepartureCascade(RosterRepository repository, MembershipWriter membershipWriter) {
        this.repository = repository;
        this.membershipWriter = membershipWriter;
    }

    @Override
    public String name() {
        return "stable-departure";
    }

    @Override
    public Set<Transition> triggers() {
        return Set.of(Transition.RELEASE, Transition.RETIRE);
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.WRESTLER, EntityType.TAG_TEAM, EntityType.MANAGER);
    }

    @Override
    public int apply(CascadeContext context) {
        List<Membership> open = repository.openMembershipsOfMember(MembershipKind.STABLE_MEMBER, context.subject());
        open.forEach(membership -> membershipWriter.end(context.transaction(), membership, context.effectiveDate()));
        return open.size();
    }
}
