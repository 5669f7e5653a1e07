package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.membership.MembershipWriter;
import com.ringside.roster.repository.RosterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * A wrestler who is released or retires leaves their tag team. The team's
 * employment status is not changed; it simply stops being bookable while it is
 * short of partners.
 */
public class TagTeamDepartureCascade implements CascadeStrategy {
    private static final Logger log = LoggerFactory.getLogger(TagTeamDepartureCascade.class);

    private final RosterRepository repository;
    private final MembershipWriter membershipWriter;
    private final int requiredPartners;

    public TagTeamDepartureCascade(RosterRepository repository, MembershipWriter membershipWriter,
                                   int requiredPartners) {
        this.repository = repository;
        this.membershipWriter = membershipWriter;
        this.requiredPartners = requiredPartners;
    }

    @Override
    public String name() {
        return "tag-team-departure";
    }

    @Override
    public Set<Transition> triggers() {
        return Set.of(Transition.RELEASE, Transition.RETIRE);
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.WRESTLER);
    }

    @Override
    public int apply(CascadeContext context) {
        List<Membership> open = repository.openMembershipsOfMember(MembershipKind.TAG_TEAM_PARTNER,
                context.subject());
        for (Membership membership : open) {
            membershipWriter.end(context.transaction(), membership, context.effectiveDate());
            int remaining = repository.openMembershipsOfGroup(MembershipKind.TAG_TEAM_PARTNER,
                    membership.group()).size();
            if (remaining < requiredPartners) {
                log.info("tagteam.short_of_partners tagTeam={} remaining={} required={}",
                        membership.group(), remaining, requiredPartners);
            }
        }
        return open.size();
    }
}
