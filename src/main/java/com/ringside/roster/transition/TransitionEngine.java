package com.ringside.roster.transition;

import com.ringside.roster.audit.AuditAction;
import com.ringside.roster.audit.AuditEntry;
import com.ringside.roster.audit.AuditService;
import com.ringside.roster.cascade.CascadeContext;
import com.ringside.roster.cascade.CascadeEngine;
import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.PeriodHistory;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.Stable;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.core.model.Title;
import com.ringside.roster.core.model.TitleChampionship;
import com.ringside.roster.core.model.TitleStatus;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.ledger.PeriodLedger;
import com.ringside.roster.logging.LogContext;
import com.ringside.roster.metrics.MetricsService;
import com.ringside.roster.repository.RosterLookup;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.status.StatusProjector;
import com.ringside.roster.validation.TransitionValidators;
import com.ringside.roster.validation.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies lifecycle transitions to roster members, titles and stables.
 *
 * <p>Every transition runs the same sequence inside one unit of work:</p>
 * <ol>
 *   <li>load the period history and project the current status</li>
 *   <li>validate the request against the (family, transition) rules</li>
 *   <li>write the period changes to the ledger</li>
 *   <li>re-project and store the cached status</li>
 *   <li>fire the cascades for related entities</li>
 * </ol>
 * Any failure rolls back every write of the unit, cascades included.
 * Cascades that transition related entities call back into this engine and
 * join the unit already in progress.
 */
public class TransitionEngine {
    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    private final RosterRepository repository;
    private final RosterLookup lookup;
    private final PeriodLedger ledger;
    private final StatusProjector projector;
    private final TransitionValidators validators;
    private final CascadeEngine cascadeEngine;
    private final UnitOfWork unitOfWork;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;

    public TransitionEngine(RosterRepository repository,
                            PeriodLedger ledger,
                            StatusProjector projector,
                            TransitionValidators validators,
                            CascadeEngine cascadeEngine,
                            UnitOfWork unitOfWork,
                            AuditService auditService,
                            MetricsService metricsService,
                            Clock clock) {
        this.repository = repository;
        this.lookup = new RosterLookup(repository);
        this.ledger = ledger;
        this.projector = projector;
        this.validators = validators;
        this.cascadeEngine = cascadeEngine;
        this.unitOfWork = unitOfWork;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Applies a transition to a wrestler, referee, manager or tag team.
     *
     * @param ref           the member
     * @param transition    transition to apply
     * @param effectiveDate date it takes effect; {@code null} means now
     * @param notes         optional notes, kept on the retirement period
     * @return the member with its refreshed status
     * @throws CannotTransitionException if the transition is not legal for the member
     * @throws EntityNotFoundException   if the member does not exist or was deleted
     */
    public RosterMember transitionMember(EntityRef ref, Transition transition, Instant effectiveDate, String notes) {
        if (!ref.type().isRosterMember()) {
            throw new IllegalArgumentException(ref.type().getLabel() + " is not a roster member");
        }
        apply(ref, transition, effectiveDate, notes);
        return loadMember(ref);
    }

    /**
     * Applies a transition to a title.
     */
    public Title transitionTitle(String titleId, Transition transition, Instant effectiveDate, String notes) {
        apply(EntityRef.title(titleId), transition, effectiveDate, notes);
        return loadTitle(titleId);
    }

    /**
     * Applies a transition to a stable.
     */
    public Stable transitionStable(String stableId, Transition transition, Instant effectiveDate, String notes) {
        apply(EntityRef.stable(stableId), transition, effectiveDate, notes);
        return lookup.stable(stableId);
    }

    /**
     * Applies a transition and reports the status change.
     */
    public TransitionOutcome apply(EntityRef subject, Transition transition, Instant effectiveDate, String notes) {
        if (unitOfWork.inProgress()) {
            return unitOfWork.execute(Set.of(subject), ctx -> perform(ctx, subject, transition, effectiveDate, notes));
        }

        String correlationId = LogContext.generateCorrelationId();
        long start = System.nanoTime();
        try (LogContext logCtx = LogContext.forTransition(correlationId, subject, transition)) {
            try {
                TransitionOutcome outcome = unitOfWork.execute(correlationId, () -> lockSet(subject, transition),
                        ctx -> perform(ctx, subject, transition, effectiveDate, notes));
                metricsService.incrementTransitionApplied(subject.type(), transition);
                return outcome;
            } catch (CannotTransitionException e) {
                metricsService.incrementTransitionRejected(subject.type(), transition);
                auditService.record(AuditEntry.builder()
                        .action(AuditAction.TRANSITION_REJECTED)
                        .entityId(subject.id())
                        .entityType(subject.type().name())
                        .actorId(unitOfWork.getActorId())
                        .correlationId(correlationId)
                        .details(Map.of("transition", transition.getLabel(),
                                "status", e.getCurrentStatus(),
                                "reason", e.getMessage()))
                        .timestamp(clock.instant())
                        .build());
                log.warn("transition.rejected subject={} transition={} reason={}",
                        subject, transition.getLabel(), e.getMessage());
                throw e;
            } finally {
                metricsService.recordTransitionDuration(subject.type(), transition,
                        Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    /**
     * Whether the transition would currently be accepted, without applying it.
     */
    public boolean canTransition(EntityRef subject, Transition transition, Instant effectiveDate) {
        Instant now = clock.instant();
        PeriodHistory history = ledger.history(requireExisting(subject));
        Enum<?> status = project(subject.type(), history, now);
        return validators.isAllowed(new ValidationContext(subject, transition, status, history,
                effectiveDate != null ? effectiveDate : now, now));
    }

    /**
     * Projects the current status of a member, title or stable from its periods.
     */
    public Enum<?> projectStatus(EntityRef subject) {
        return project(subject.type(), ledger.history(requireExisting(subject)), clock.instant());
    }

    public EmploymentStatus projectMember(EntityRef member) {
        return projector.project(ledger.history(member), clock.instant());
    }

    /**
     * Re-projects the status of an entity and corrects its cached value if it has drifted,
     * e.g. a future employment whose start date has since passed.
     */
    public Enum<?> resyncStatus(EntityRef subject) {
        return unitOfWork.execute(Set.of(subject), ctx -> {
            requireExisting(subject);
            Enum<?> status = project(subject.type(), ledger.history(subject), clock.instant());
            storeStatus(ctx.transaction(), subject, status);
            return status;
        });
    }

    private TransitionOutcome perform(TransitionContext ctx, EntityRef subject, Transition transition,
                                      Instant effectiveDate, String notes) {
        requireExisting(subject);
        Instant now = clock.instant();
        Instant date = effectiveDate != null ? effectiveDate : now;

        PeriodHistory history = ledger.history(subject);
        Enum<?> from = project(subject.type(), history, now);
        validators.validate(new ValidationContext(subject, transition, from, history, date, now));

        TransitionTransaction tx = ctx.transaction();
        for (PeriodKind kind : transition.closes()) {
            ledger.close(tx, subject, kind, date);
        }
        if (reschedulesPending(transition, from)) {
            ledger.reschedule(tx, subject, transition.opens().get(0), date);
        } else {
            for (PeriodKind kind : transition.opens()) {
                ledger.open(tx, subject, kind, date, kind == PeriodKind.RETIREMENT ? notes : null);
            }
        }

        Enum<?> to = project(subject.type(), ledger.history(subject), now);
        storeStatus(tx, subject, to);

        Map<String, Object> details = new HashMap<>();
        details.put("transition", transition.getLabel());
        details.put("from", from.name());
        details.put("to", to.name());
        details.put("effectiveDate", date.toString());
        if (notes != null) {
            details.put("notes", notes);
        }
        ctx.audit(AuditAction.TRANSITION_APPLIED, subject, now, details);
        log.info("transition.applied subject={} transition={} from={} to={} effectiveDate={}",
                subject, transition.getLabel(), from, to, date);

        int cascaded = cascadeEngine.fire(new CascadeContext(this, ctx, subject, transition, date, now));
        return new TransitionOutcome(subject, transition, from, to, date, cascaded);
    }

    // employing a future-employed member (or activating a pending title) moves the scheduled start
    private boolean reschedulesPending(Transition transition, Enum<?> from) {
        return (transition == Transition.EMPLOY && from == EmploymentStatus.FUTURE_EMPLOYED)
                || (transition == Transition.ACTIVATE
                && (from == TitleStatus.PENDING_ACTIVATION || from == StableStatus.PENDING_DEBUT));
    }

    private Enum<?> project(EntityType type, PeriodHistory history, Instant now) {
        return switch (type) {
            case TITLE -> projector.projectTitle(history, now);
            case STABLE -> projector.projectStable(history, now);
            default -> projector.project(history, now);
        };
    }

    private void storeStatus(TransitionTransaction tx, EntityRef subject, Enum<?> status) {
        if (subject.type() == EntityType.TITLE) {
            Title title = loadTitle(subject.id());
            if (title.getStatus() != status) {
                Title updated = Title.builder(title).status((TitleStatus) status).build();
                tx.execute("resync status of " + subject,
                        () -> repository.saveTitle(updated),
                        () -> repository.saveTitle(title));
            }
            return;
        }
        if (subject.type() == EntityType.STABLE) {
            Stable stable = lookup.stable(subject.id());
            if (stable.status() != status) {
                tx.execute("resync status of " + subject,
                        () -> repository.saveStable(stable.withStatus((StableStatus) status)),
                        () -> repository.saveStable(stable));
            }
            return;
        }
        RosterMember member = loadMember(subject);
        if (member.getStatus() != status) {
            RosterMember updated = RosterMember.builder(member).status((EmploymentStatus) status).build();
            tx.execute("resync status of " + subject,
                    () -> repository.saveMember(updated),
                    () -> repository.saveMember(member));
        }
    }

    private EntityRef requireExisting(EntityRef subject) {
        return lookup.require(subject);
    }

    private RosterMember loadMember(EntityRef ref) {
        return lookup.member(ref);
    }

    private Title loadTitle(String titleId) {
        return lookup.title(titleId);
    }

    /**
     * The subject, every entity its cascades may write to, and for an
     * employment every member the employment cascades may go on to employ,
     * followed transitively: a tag team's partners and the managers of each.
     * All of them are locked in rank order before the unit starts, so a
     * nested transition never has to take a lock out of order.
     */
    Set<EntityRef> lockSet(EntityRef subject, Transition transition) {
        Set<EntityRef> refs = new LinkedHashSet<>();
        refs.add(subject);
        addRelated(refs, subject);
        if (transition == Transition.EMPLOY) {
            Set<EntityRef> visited = new HashSet<>();
            visited.add(subject);
            Deque<EntityRef> pending = new ArrayDeque<>(employmentFollowers(subject));
            while (!pending.isEmpty()) {
                EntityRef follower = pending.pop();
                if (visited.add(follower)) {
                    refs.add(follower);
                    pending.addAll(employmentFollowers(follower));
                }
            }
        }
        return refs;
    }

    private void addRelated(Set<EntityRef> refs, EntityRef subject) {
        for (Membership membership : repository.membershipsInvolving(subject)) {
            if (membership.isCurrent()) {
                refs.add(membership.group());
                refs.add(membership.member());
            }
        }
        if (subject.type() == EntityType.TITLE) {
            repository.currentChampionship(subject.id()).ifPresent(reign -> refs.add(reign.champion()));
        } else if (subject.type().canHoldTitles()) {
            for (TitleChampionship reign : repository.openChampionshipsHeldBy(subject)) {
                refs.add(EntityRef.title(reign.titleId()));
            }
        }
    }

    private List<EntityRef> employmentFollowers(EntityRef member) {
        List<EntityRef> followers = new ArrayList<>();
        if (member.type() == EntityType.TAG_TEAM) {
            repository.openMembershipsOfGroup(MembershipKind.TAG_TEAM_PARTNER, member)
                    .forEach(partnership -> followers.add(partnership.member()));
        }
        if (member.type().canBeManaged()) {
            repository.openMembershipsOfMember(MembershipKind.MANAGEMENT, member)
                    .forEach(management -> followers.add(management.group()));
        }
        return followers;
    }
}
