package com.ringside.roster.membership;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.transition.TransitionTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes membership rows with their rules checked and their inverse registered
 * on the caller's transaction. Shared by the membership service, the departure
 * cascades and entity restore so every path applies the same rules.
 */
public class MembershipWriter {
    private static final Logger log = LoggerFactory.getLogger(MembershipWriter.class);

    private final RosterRepository repository;
    private final int maxTagTeamPartners;
    private final boolean singleStableMembership;

    public MembershipWriter(RosterRepository repository, int maxTagTeamPartners, boolean singleStableMembership) {
        this.repository = repository;
        this.maxTagTeamPartners = maxTagTeamPartners;
        this.singleStableMembership = singleStableMembership;
    }

    /**
     * Attaches a member to a group.
     *
     * @throws MembershipConflictException if the membership would break a membership rule
     */
    public Membership attach(TransitionTransaction tx, MembershipKind kind, EntityRef group, EntityRef member,
                             Instant joinedAt) {
        Objects.requireNonNull(joinedAt, "joinedAt is required");
        if (!kind.accepts(member.type())) {
            throw MembershipConflictException.unsupportedMember(kind, member);
        }

        List<Membership> open = repository.openMembershipsOfMember(kind, member);
        for (Membership existing : open) {
            if (existing.group().equals(group)) {
                throw MembershipConflictException.alreadyMember(kind, group, member);
            }
        }

        switch (kind) {
            case TAG_TEAM_PARTNER -> {
                if (!open.isEmpty()) {
                    throw MembershipConflictException.alreadyInAnotherGroup(kind, member, open.get(0));
                }
                if (repository.openMembershipsOfGroup(kind, group).size() >= maxTagTeamPartners) {
                    throw MembershipConflictException.groupFull(kind, group, member, maxTagTeamPartners);
                }
            }
            case STABLE_MEMBER -> {
                if (repository.findStable(group.id()).map(s -> s.status() == StableStatus.RETIRED).orElse(false)) {
                    throw MembershipConflictException.groupRetired(kind, group, member);
                }
                if (singleStableMembership && !open.isEmpty()) {
                    throw MembershipConflictException.alreadyInAnotherGroup(kind, member, open.get(0));
                }
            }
            case MANAGEMENT -> {
                // a client may have several managers
            }
        }

        Optional<Instant> lastLeftAt = repository.membershipsOfMember(kind, member).stream()
                .map(Membership::leftAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo);
        if (lastLeftAt.isPresent() && joinedAt.isBefore(lastLeftAt.get())) {
            throw MembershipConflictException.joinedBeforeLastLeave(kind, member, joinedAt, lastLeftAt.get());
        }

        Membership membership = tx.execute("attach " + kind + " " + member + " to " + group,
                () -> repository.attachMembership(kind, group, member, joinedAt),
                created -> repository.deleteMembership(created.id()));
        log.debug("membership.attached kind={} group={} member={} joinedAt={}", kind, group, member, joinedAt);
        return membership;
    }

    /**
     * Ends the member's current membership in the group. Returns empty when there is none.
     */
    public Optional<Membership> detach(TransitionTransaction tx, MembershipKind kind, EntityRef group,
                                       EntityRef member, Instant leftAt) {
        return repository.openMembershipsOfGroup(kind, group).stream()
                .filter(m -> m.member().equals(member))
                .findFirst()
                .map(open -> end(tx, open, leftAt));
    }

    /**
     * Ends a known open membership row.
     *
     * @throws MembershipConflictException if {@code leftAt} is before the join date
     */
    public Membership end(TransitionTransaction tx, Membership open, Instant leftAt) {
        if (leftAt.isBefore(open.joinedAt())) {
            throw MembershipConflictException.leftBeforeJoin(open, leftAt);
        }
        Membership ended = tx.execute("detach " + open.kind() + " " + open.member() + " from " + open.group(),
                        () -> repository.detachOpenMembership(open.kind(), open.group(), open.member(), leftAt),
                        detached -> repository.updateMembership(open))
                .orElse(open.withLeftAt(leftAt));
        log.debug("membership.detached kind={} group={} member={} leftAt={}",
                open.kind(), open.group(), open.member(), leftAt);
        return ended;
    }
}
