package com.ringside.roster.membership;

import com.ringside.roster.audit.AuditAction;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.logging.LogContext;
import com.ringside.roster.repository.RosterLookup;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.transition.EntityNotFoundException;
import com.ringside.roster.transition.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Manages tag-team partners, stable members and manager assignments.
 * Dates default to now when {@code null}.
 */
public class MembershipService {
    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final RosterRepository repository;
    private final RosterLookup lookup;
    private final MembershipWriter writer;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public MembershipService(RosterRepository repository, MembershipWriter writer, UnitOfWork unitOfWork,
                             Clock clock) {
        this.repository = repository;
        this.lookup = new RosterLookup(repository);
        this.writer = writer;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    // ---- tag teams ----

    public Membership addTagTeamPartner(String tagTeamId, String wrestlerId, Instant joinedAt) {
        return join(MembershipKind.TAG_TEAM_PARTNER, EntityRef.tagTeam(tagTeamId), EntityRef.wrestler(wrestlerId),
                joinedAt);
    }

    public Membership removeTagTeamPartner(String tagTeamId, String wrestlerId, Instant leftAt) {
        return leave(MembershipKind.TAG_TEAM_PARTNER, EntityRef.tagTeam(tagTeamId), EntityRef.wrestler(wrestlerId),
                leftAt);
    }

    public List<EntityRef> currentPartners(String tagTeamId) {
        return members(MembershipKind.TAG_TEAM_PARTNER, EntityRef.tagTeam(tagTeamId));
    }

    // ---- stables ----

    /**
     * Adds a wrestler, tag team or manager to a stable.
     *
     * @throws MembershipConflictException if the member already belongs to a stable
     */
    public Membership joinStable(String stableId, EntityRef member, Instant joinedAt) {
        return join(MembershipKind.STABLE_MEMBER, EntityRef.stable(stableId), member, joinedAt);
    }

    public Membership leaveStable(String stableId, EntityRef member, Instant leftAt) {
        return leave(MembershipKind.STABLE_MEMBER, EntityRef.stable(stableId), member, leftAt);
    }

    public List<EntityRef> currentStableMembers(String stableId) {
        return members(MembershipKind.STABLE_MEMBER, EntityRef.stable(stableId));
    }

    // ---- managers ----

    public Membership assignManager(String managerId, EntityRef client, Instant assignedAt) {
        return join(MembershipKind.MANAGEMENT, EntityRef.manager(managerId), client, assignedAt);
    }

    public Membership removeManager(String managerId, EntityRef client, Instant removedAt) {
        return leave(MembershipKind.MANAGEMENT, EntityRef.manager(managerId), client, removedAt);
    }

    public List<EntityRef> currentClients(String managerId) {
        return members(MembershipKind.MANAGEMENT, EntityRef.manager(managerId));
    }

    public List<EntityRef> currentManagers(EntityRef client) {
        return repository.openMembershipsOfMember(MembershipKind.MANAGEMENT, client).stream()
                .map(Membership::group)
                .toList();
    }

    /**
     * Full membership history of an entity, as group or as member.
     */
    public List<Membership> history(EntityRef ref) {
        return repository.membershipsInvolving(ref);
    }

    private Membership join(MembershipKind kind, EntityRef group, EntityRef member, Instant joinedAt) {
        lookup.require(group);
        lookup.require(member);
        Instant date = joinedAt != null ? joinedAt : clock.instant();

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forMembership(correlationId, kind, group, member)) {
            Membership membership = unitOfWork.execute(correlationId, Set.of(group, member), ctx -> {
                Membership attached = writer.attach(ctx.transaction(), kind, group, member, date);
                ctx.audit(AuditAction.MEMBERSHIP_CHANGED, member, clock.instant(), Map.of(
                        "change", "joined",
                        "kind", kind.name(),
                        "group", group.key(),
                        "date", date.toString()));
                return attached;
            });
            log.info("membership.joined kind={} group={} member={} joinedAt={}", kind, group, member, date);
            return membership;
        }
    }

    private Membership leave(MembershipKind kind, EntityRef group, EntityRef member, Instant leftAt) {
        lookup.require(group);
        lookup.require(member);
        Instant date = leftAt != null ? leftAt : clock.instant();

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forMembership(correlationId, kind, group, member)) {
            Membership membership = unitOfWork.execute(correlationId, Set.of(group, member), ctx -> {
                Membership detached = writer.detach(ctx.transaction(), kind, group, member, date)
                        .orElseThrow(() -> EntityNotFoundException.membership(group, member));
                ctx.audit(AuditAction.MEMBERSHIP_CHANGED, member, clock.instant(), Map.of(
                        "change", "left",
                        "kind", kind.name(),
                        "group", group.key(),
                        "date", date.toString()));
                return detached;
            });
            log.info("membership.left kind={} group={} member={} leftAt={}", kind, group, member, date);
            return membership;
        }
    }

    private List<EntityRef> members(MembershipKind kind, EntityRef group) {
        return repository.openMembershipsOfGroup(kind, group).stream()
                .map(Membership::member)
                .toList();
    }
}
