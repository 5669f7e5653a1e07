package com.ringside.roster.repository;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.Stable;
import com.ringside.roster.core.model.Title;
import com.ringside.roster.core.model.TitleChampionship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link RosterRepository}.
 * Thread-safe via concurrent maps; suitable for testing and single-JVM deployments.
 * This is the default implementation used by the lifecycle facade.
 */
public class InMemoryRosterRepository implements RosterRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRosterRepository.class);

    private final ConcurrentMap<String, RosterMember> members = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Title> titles = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Stable> stables = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Period> periods = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Membership> memberships = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, TitleChampionship> championships = new ConcurrentHashMap<>();

    @Override
    public RosterMember saveMember(RosterMember member) {
        members.put(member.getId(), member);
        return member;
    }

    @Override
    public Optional<RosterMember> findMember(String id) {
        return Optional.ofNullable(members.get(id));
    }

    @Override
    public List<RosterMember> findMembersByType(EntityType type) {
        return members.values().stream()
                .filter(m -> m.getType() == type)
                .sorted(Comparator.comparing(RosterMember::getName))
                .toList();
    }

    @Override
    public Title saveTitle(Title title) {
        titles.put(title.getId(), title);
        return title;
    }

    @Override
    public Optional<Title> findTitle(String id) {
        return Optional.ofNullable(titles.get(id));
    }

    @Override
    public Stable saveStable(Stable stable) {
        stables.put(stable.id(), stable);
        return stable;
    }

    @Override
    public Optional<Stable> findStable(String id) {
        return Optional.ofNullable(stables.get(id));
    }

    @Override
    public Period createPeriod(EntityRef owner, PeriodKind kind, Instant startedAt, String notes) {
        Period period = new Period(UUID.randomUUID().toString(), owner, kind, startedAt, null, notes);
        periods.put(period.id(), period);
        log.debug("Created {} period {} for {} starting {}", kind, period.id(), owner, startedAt);
        return period;
    }

    @Override
    public Optional<Period> endOpenPeriod(EntityRef owner, PeriodKind kind, Instant endedAt) {
        return currentPeriod(owner, kind).map(open -> {
            Period closed = open.withEndedAt(endedAt);
            periods.put(closed.id(), closed);
            log.debug("Ended {} period {} for {} at {}", kind, closed.id(), owner, endedAt);
            return closed;
        });
    }

    @Override
    public Optional<Period> currentPeriod(EntityRef owner, PeriodKind kind) {
        return periods.values().stream()
                .filter(p -> p.owner().equals(owner) && p.kind() == kind && p.isOpen())
                .findFirst();
    }

    @Override
    public List<Period> previousPeriods(EntityRef owner, PeriodKind kind) {
        return periods.values().stream()
                .filter(p -> p.owner().equals(owner) && p.kind() == kind && p.isClosed())
                .sorted(Comparator.comparing(Period::startedAt))
                .toList();
    }

    @Override
    public List<Period> findPeriods(EntityRef owner) {
        return periods.values().stream()
                .filter(p -> p.owner().equals(owner))
                .sorted(Comparator.comparing(Period::startedAt))
                .toList();
    }

    @Override
    public Period updatePeriod(Period period) {
        periods.put(period.id(), period);
        return period;
    }

    @Override
    public void deletePeriod(String periodId) {
        periods.remove(periodId);
    }

    @Override
    public Membership attachMembership(MembershipKind kind, EntityRef group, EntityRef member, Instant joinedAt) {
        Membership membership = new Membership(UUID.randomUUID().toString(), kind, group, member, joinedAt, null);
        memberships.put(membership.id(), membership);
        log.debug("Attached {} to {} as {} at {}", member, group, kind, joinedAt);
        return membership;
    }

    @Override
    public Optional<Membership> detachOpenMembership(MembershipKind kind, EntityRef group, EntityRef member,
                                                     Instant leftAt) {
        return memberships.values().stream()
                .filter(m -> m.kind() == kind && m.group().equals(group) && m.member().equals(member) && m.isCurrent())
                .findFirst()
                .map(open -> {
                    Membership closed = open.withLeftAt(leftAt);
                    memberships.put(closed.id(), closed);
                    log.debug("Detached {} from {} ({}) at {}", member, group, kind, leftAt);
                    return closed;
                });
    }

    @Override
    public List<Membership> openMembershipsOfGroup(MembershipKind kind, EntityRef group) {
        return memberships.values().stream()
                .filter(m -> m.kind() == kind && m.group().equals(group) && m.isCurrent())
                .sorted(Comparator.comparing(Membership::joinedAt))
                .toList();
    }

    @Override
    public List<Membership> openMembershipsOfMember(MembershipKind kind, EntityRef member) {
        return memberships.values().stream()
                .filter(m -> m.kind() == kind && m.member().equals(member) && m.isCurrent())
                .sorted(Comparator.comparing(Membership::joinedAt))
                .toList();
    }

    @Override
    public List<Membership> membershipsOfMember(MembershipKind kind, EntityRef member) {
        return memberships.values().stream()
                .filter(m -> m.kind() == kind && m.member().equals(member))
                .sorted(Comparator.comparing(Membership::joinedAt))
                .toList();
    }

    @Override
    public List<Membership> membershipsInvolving(EntityRef ref) {
        return memberships.values().stream()
                .filter(m -> m.involves(ref))
                .sorted(Comparator.comparing(Membership::joinedAt))
                .toList();
    }

    @Override
    public Membership updateMembership(Membership membership) {
        memberships.put(membership.id(), membership);
        return membership;
    }

    @Override
    public void deleteMembership(String membershipId) {
        memberships.remove(membershipId);
    }

    @Override
    public TitleChampionship createChampionship(String titleId, EntityRef champion, Instant wonAt) {
        TitleChampionship championship = new TitleChampionship(
                UUID.randomUUID().toString(), titleId, champion, wonAt, null);
        championships.put(championship.id(), championship);
        log.debug("Created championship {} on title {} for {} at {}", championship.id(), titleId, champion, wonAt);
        return championship;
    }

    @Override
    public Optional<TitleChampionship> endOpenChampionship(String titleId, Instant lostAt) {
        return currentChampionship(titleId).map(open -> {
            TitleChampionship closed = open.withLostAt(lostAt);
            championships.put(closed.id(), closed);
            log.debug("Ended championship {} on title {} at {}", closed.id(), titleId, lostAt);
            return closed;
        });
    }

    @Override
    public Optional<TitleChampionship> currentChampionship(String titleId) {
        return championships.values().stream()
                .filter(c -> c.titleId().equals(titleId) && c.isCurrent())
                .findFirst();
    }

    @Override
    public List<TitleChampionship> findChampionships(String titleId) {
        return championships.values().stream()
                .filter(c -> c.titleId().equals(titleId))
                .sorted(Comparator.comparing(TitleChampionship::wonAt))
                .toList();
    }

    @Override
    public List<TitleChampionship> openChampionshipsHeldBy(EntityRef champion) {
        return championships.values().stream()
                .filter(c -> c.champion().equals(champion) && c.isCurrent())
                .sorted(Comparator.comparing(TitleChampionship::wonAt))
                .toList();
    }

    @Override
    public TitleChampionship updateChampionship(TitleChampionship championship) {
        championships.put(championship.id(), championship);
        return championship;
    }

    @Override
    public void deleteChampionship(String championshipId) {
        championships.remove(championshipId);
    }
}
