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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary consumed by transition actions and cascades.
 * Implementations provide the storage engine (in-memory, relational, etc.).
 *
 * <p>Each write is a single-row operation. Grouping writes into an
 * all-or-nothing unit is done by the caller, which registers an inverse
 * operation for every write it performs. The {@code update*} and
 * {@code delete*} methods exist for those inverse operations.</p>
 */
public interface RosterRepository {

    // ---- entities ----

    RosterMember saveMember(RosterMember member);

    Optional<RosterMember> findMember(String id);

    /**
     * Gets members of one type, deleted ones included.
     */
    List<RosterMember> findMembersByType(EntityType type);

    Title saveTitle(Title title);

    Optional<Title> findTitle(String id);

    Stable saveStable(Stable stable);

    Optional<Stable> findStable(String id);

    // ---- period ledger ----

    /**
     * Creates a new open period.
     */
    Period createPeriod(EntityRef owner, PeriodKind kind, Instant startedAt, String notes);

    /**
     * Ends the open period of the given kind. Returns the closed period, or empty
     * when no period of that kind is open (a no-op).
     */
    Optional<Period> endOpenPeriod(EntityRef owner, PeriodKind kind, Instant endedAt);

    Optional<Period> currentPeriod(EntityRef owner, PeriodKind kind);

    /**
     * Gets the closed periods of the given kind, ordered by start.
     */
    List<Period> previousPeriods(EntityRef owner, PeriodKind kind);

    /**
     * Gets every period of the owner, open and closed.
     */
    List<Period> findPeriods(EntityRef owner);

    Period updatePeriod(Period period);

    void deletePeriod(String periodId);

    // ---- memberships ----

    Membership attachMembership(MembershipKind kind, EntityRef group, EntityRef member, Instant joinedAt);

    /**
     * Ends the member's open membership in the group. Returns empty when none is open.
     */
    Optional<Membership> detachOpenMembership(MembershipKind kind, EntityRef group, EntityRef member, Instant leftAt);

    List<Membership> openMembershipsOfGroup(MembershipKind kind, EntityRef group);

    List<Membership> openMembershipsOfMember(MembershipKind kind, EntityRef member);

    /**
     * Gets every membership row of the member for a kind, ordered by join date.
     */
    List<Membership> membershipsOfMember(MembershipKind kind, EntityRef member);

    /**
     * Gets every membership row where the entity is either the group or the member.
     */
    List<Membership> membershipsInvolving(EntityRef ref);

    Membership updateMembership(Membership membership);

    void deleteMembership(String membershipId);

    // ---- championships ----

    TitleChampionship createChampionship(String titleId, EntityRef champion, Instant wonAt);

    /**
     * Ends the title's open championship. Returns empty when the title is vacant.
     */
    Optional<TitleChampionship> endOpenChampionship(String titleId, Instant lostAt);

    Optional<TitleChampionship> currentChampionship(String titleId);

    /**
     * Gets every championship of the title, ordered by the date won.
     */
    List<TitleChampionship> findChampionships(String titleId);

    List<TitleChampionship> openChampionshipsHeldBy(EntityRef champion);

    TitleChampionship updateChampionship(TitleChampionship championship);

    void deleteChampionship(String championshipId);
}
