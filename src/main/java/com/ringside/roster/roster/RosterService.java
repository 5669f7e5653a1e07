package com.ringside.roster.roster;

import com.ringside.roster.audit.AuditAction;
import com.ringside.roster.audit.AuditService;
import com.ringside.roster.championship.ChampionshipException;
import com.ringside.roster.core.RosterException;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.Stable;
import com.ringside.roster.core.model.Title;
import com.ringside.roster.core.model.TitleChampionship;
import com.ringside.roster.logging.LogContext;
import com.ringside.roster.membership.MembershipConflictException;
import com.ringside.roster.membership.MembershipWriter;
import com.ringside.roster.repository.RosterLookup;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.transition.EntityNotFoundException;
import com.ringside.roster.transition.TransitionContext;
import com.ringside.roster.transition.TransitionEngine;
import com.ringside.roster.transition.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates roster entities and handles soft deletion and restore.
 *
 * <p>A deleted member, title or stable stays in the repository with a deletion date
 * and is reported as not found by every other operation. Deleting ends the
 * entity's current memberships; restoring can re-attach the memberships that
 * the deletion ended.</p>
 */
public class RosterService {
    private static final Logger log = LoggerFactory.getLogger(RosterService.class);

    static final String ENDED_MEMBERSHIPS = "endedMemberships";

    private final RosterRepository repository;
    private final RosterLookup lookup;
    private final MembershipWriter membershipWriter;
    private final TransitionEngine transitionEngine;
    private final UnitOfWork unitOfWork;
    private final AuditService auditService;
    private final Clock clock;

    public RosterService(RosterRepository repository, MembershipWriter membershipWriter,
                         TransitionEngine transitionEngine, UnitOfWork unitOfWork, AuditService auditService,
                         Clock clock) {
        this.repository = repository;
        this.lookup = new RosterLookup(repository);
        this.membershipWriter = membershipWriter;
        this.transitionEngine = transitionEngine;
        this.unitOfWork = unitOfWork;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Creates an unemployed wrestler, referee, manager or tag team.
     */
    public RosterMember createMember(EntityType type, String name) {
        RosterMember member = repository.saveMember(RosterMember.builder()
                .type(type)
                .name(name)
                .createdAt(clock.instant())
                .build());
        recordCreated(member.ref(), name);
        return member;
    }

    /**
     * Creates an unactivated title.
     */
    public Title createTitle(String name) {
        Title title = repository.saveTitle(Title.builder()
                .name(name)
                .createdAt(clock.instant())
                .build());
        recordCreated(title.ref(), name);
        return title;
    }

    public Stable createStable(String name) {
        Stable stable = repository.saveStable(Stable.create(name, clock.instant()));
        recordCreated(stable.ref(), name);
        return stable;
    }

    public Optional<RosterMember> findMember(EntityRef ref) {
        return repository.findMember(ref.id())
                .filter(member -> member.getType() == ref.type() && !member.isDeleted());
    }

    public Optional<Title> findTitle(String titleId) {
        return repository.findTitle(titleId).filter(title -> !title.isDeleted());
    }

    public Optional<Stable> findStable(String stableId) {
        return repository.findStable(stableId).filter(stable -> !stable.isDeleted());
    }

    public List<RosterMember> findMembers(EntityType type) {
        return repository.findMembersByType(type).stream()
                .filter(member -> !member.isDeleted())
                .toList();
    }

    /**
     * Re-projects the cached status of a member, title or stable from its periods.
     */
    public Enum<?> resyncStatus(EntityRef ref) {
        return transitionEngine.resyncStatus(ref);
    }

    /**
     * Soft-deletes a member, title or stable. The memberships the deletion ends
     * are recorded on its audit entry so a later restore can re-attach them.
     *
     * @throws ChampionshipException if the entity holds a title, or is a title with a champion
     */
    public void delete(EntityRef ref, Instant deletedAt) {
        Instant date = deletedAt != null ? deletedAt : clock.instant();

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forRoster(correlationId, ref, "delete")) {
            int ended = unitOfWork.execute(correlationId, () -> lockSet(ref), ctx -> {
                switch (ref.type()) {
                    case TITLE -> deleteTitle(ctx, ref, date);
                    case STABLE -> deleteStable(ctx, ref, date);
                    default -> deleteMember(ctx, ref, date);
                }
                List<Membership> open = repository.membershipsInvolving(ref).stream()
                        .filter(Membership::isCurrent)
                        .toList();
                open.forEach(membership -> membershipWriter.end(ctx.transaction(), membership, date));

                ctx.audit(AuditAction.ENTITY_DELETED, ref, clock.instant(), Map.of(
                        "deletedAt", date.toString(),
                        "membershipsEnded", open.size(),
                        ENDED_MEMBERSHIPS, open.stream().map(Membership::id).toList()));
                return open.size();
            });
            log.info("roster.deleted entity={} deletedAt={} membershipsEnded={}", ref, date, ended);
        }
    }

    /**
     * Restores a soft-deleted member, title or stable.
     *
     * @param restoreMemberships re-attach the memberships the deletion ended, joined at {@code restoredAt};
     *                           a membership that would now conflict is left ended
     */
    public void restore(EntityRef ref, Instant restoredAt, boolean restoreMemberships) {
        Instant date = restoredAt != null ? restoredAt : clock.instant();

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forRoster(correlationId, ref, "restore")) {
            int restored = unitOfWork.execute(correlationId, () -> lockSet(ref), ctx -> {
                switch (ref.type()) {
                    case TITLE -> restoreTitle(ctx, ref, date);
                    case STABLE -> restoreStable(ctx, ref, date);
                    default -> restoreMember(ctx, ref, date);
                }
                int reattached = restoreMemberships ? reattach(ctx, ref, date) : 0;
                transitionEngine.resyncStatus(ref);
                ctx.audit(AuditAction.ENTITY_RESTORED, ref, clock.instant(), Map.of(
                        "restoredAt", date.toString(),
                        "membershipsRestored", reattached));
                return reattached;
            });
            log.info("roster.restored entity={} restoredAt={} membershipsRestored={}", ref, date, restored);
        }
    }

    private void deleteTitle(TransitionContext ctx, EntityRef ref, Instant date) {
        Title title = lookup.title(ref.id());
        Optional<TitleChampionship> reign = repository.currentChampionship(ref.id());
        if (reign.isPresent()) {
            throw new ChampionshipException(ref.id(), "Title '" + title.getName()
                    + "' cannot be deleted while held by " + reign.get().champion());
        }
        Title deleted = Title.builder(title).deletedAt(date).build();
        ctx.transaction().execute("delete " + ref,
                () -> repository.saveTitle(deleted),
                () -> repository.saveTitle(title));
    }

    private void deleteStable(TransitionContext ctx, EntityRef ref, Instant date) {
        Stable stable = lookup.stable(ref.id());
        ctx.transaction().execute("delete " + ref,
                () -> repository.saveStable(stable.withDeletedAt(date)),
                () -> repository.saveStable(stable));
    }

    private void deleteMember(TransitionContext ctx, EntityRef ref, Instant date) {
        RosterMember member = lookup.member(ref);
        List<TitleChampionship> reigns = repository.openChampionshipsHeldBy(ref);
        if (!reigns.isEmpty()) {
            throw new ChampionshipException(reigns.get(0).titleId(), "'" + member.getName()
                    + "' cannot be deleted while holding a title");
        }
        RosterMember deleted = RosterMember.builder(member).deletedAt(date).build();
        ctx.transaction().execute("delete " + ref,
                () -> repository.saveMember(deleted),
                () -> repository.saveMember(member));
    }

    private void restoreMember(TransitionContext ctx, EntityRef ref, Instant date) {
        RosterMember member = repository.findMember(ref.id())
                .filter(m -> m.getType() == ref.type())
                .orElseThrow(() -> EntityNotFoundException.entity(ref));
        requireDeletedBefore(ref, member.getDeletedAt(), date);
        RosterMember restored = RosterMember.builder(member).deletedAt(null).build();
        ctx.transaction().execute("restore " + ref,
                () -> repository.saveMember(restored),
                () -> repository.saveMember(member));
    }

    private void restoreTitle(TransitionContext ctx, EntityRef ref, Instant date) {
        Title title = repository.findTitle(ref.id()).orElseThrow(() -> EntityNotFoundException.entity(ref));
        requireDeletedBefore(ref, title.getDeletedAt(), date);
        Title restored = Title.builder(title).deletedAt(null).build();
        ctx.transaction().execute("restore " + ref,
                () -> repository.saveTitle(restored),
                () -> repository.saveTitle(title));
    }

    private void restoreStable(TransitionContext ctx, EntityRef ref, Instant date) {
        Stable stable = repository.findStable(ref.id()).orElseThrow(() -> EntityNotFoundException.entity(ref));
        requireDeletedBefore(ref, stable.deletedAt(), date);
        ctx.transaction().execute("restore " + ref,
                () -> repository.saveStable(stable.withDeletedAt(null)),
                () -> repository.saveStable(stable));
    }

    private int reattach(TransitionContext ctx, EntityRef ref, Instant date) {
        Set<String> endedByDeletion = membershipsEndedByDeletion(ref);
        int count = 0;
        for (Membership ended : repository.membershipsInvolving(ref)) {
            if (!endedByDeletion.contains(ended.id())) {
                continue;
            }
            EntityRef other = ended.group().equals(ref) ? ended.member() : ended.group();
            if (!lookup.exists(other)) {
                log.debug("roster.restore_skipped membership={} reason=counterpart_missing counterpart={}",
                        ended.id(), other);
                continue;
            }
            try {
                membershipWriter.attach(ctx.transaction(), ended.kind(), ended.group(), ended.member(), date);
                count++;
            } catch (MembershipConflictException e) {
                log.warn("roster.restore_skipped membership={} reason={}", ended.id(), e.getMessage());
            }
        }
        return count;
    }

    private Set<String> membershipsEndedByDeletion(EntityRef ref) {
        Object ids = auditService.getLatestEntry(ref, AuditAction.ENTITY_DELETED)
                .map(entry -> entry.details().get(ENDED_MEMBERSHIPS))
                .orElse(null);
        if (!(ids instanceof Collection)) {
            log.debug("roster.restore_no_record entity={}", ref);
            return Set.of();
        }
        Set<String> result = new HashSet<>();
        for (Object id : (Collection<?>) ids) {
            result.add(String.valueOf(id));
        }
        return result;
    }

    private void requireDeletedBefore(EntityRef ref, Instant deletedAt, Instant restoredAt) {
        if (deletedAt == null) {
            throw new RosterException(ref + " is not deleted");
        }
        if (restoredAt.isBefore(deletedAt)) {
            throw new RosterException(ref + " cannot be restored at " + restoredAt + ", it was deleted " + deletedAt);
        }
    }

    private Set<EntityRef> lockSet(EntityRef ref) {
        Set<EntityRef> refs = new LinkedHashSet<>();
        refs.add(ref);
        for (Membership membership : repository.membershipsInvolving(ref)) {
            refs.add(membership.group());
            refs.add(membership.member());
        }
        return refs;
    }

    private void recordCreated(EntityRef ref, String name) {
        unitOfWork.execute(Set.of(ref), ctx -> {
            ctx.audit(AuditAction.ENTITY_CREATED, ref, clock.instant(), Map.of("name", name));
            return ref;
        });
        log.info("roster.created entity={} name={}", ref, name);
    }
}
