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
 * A stable that retires or is disbanded releases all of its current members.
 * The members' own statuses are untouched.
 */
public class StableRetirementCascade implements CascadeStrategy {

    private final RosterRepository repository;
    private final MembershipWriter membershipWriter;

    public StableRetirementCascade(RosterRepository repository, MembershipWriter membershipWriter) {
        this.repository = repository;
        this.membershipWriter = membershipWriter;
    }

    @Override
    public String name() {
        return "stable-disassembled";
    }

    @Override
    public Set<Transition> triggers() {
        return Set.of(Transition.DEACTIVATE, Transition.RETIRE);
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.STABLE);
    }

    @Override
    public int apply(CascadeContext context) {
        List<Membership> open = repository.openMembershipsOfGroup(MembershipKind.STABLE_MEMBER, context.subject());
        open.forEach(membership -> membershipWriter.end(context.transaction(), membership, context.effectiveDate()));
        return open.size();
    }
}
