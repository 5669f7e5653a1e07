package com.ringside.roster.championship;

import com.ringside.roster.audit.AuditAction;
import com.ringside.roster.availability.AvailabilityService;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.Title;
import com.ringside.roster.core.model.TitleChampionship;
import com.ringside.roster.logging.LogContext;
import com.ringside.roster.repository.RosterLookup;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.transition.EntityNotFoundException;
import com.ringside.roster.transition.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Awards and vacates titles and reports on title reigns.
 *
 * <p>A title has at most one open championship. Awarding a title that is
 * already held ends the current reign at the moment the new one starts.</p>
 */
public class ChampionshipService {
    private static final Logger log = LoggerFactory.getLogger(ChampionshipService.class);

    private final RosterRepository repository;
    private final RosterLookup lookup;
    private final AvailabilityService availabilityService;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public ChampionshipService(RosterRepository repository, AvailabilityService availabilityService,
                               UnitOfWork unitOfWork, Clock clock) {
        this.repository = repository;
        this.lookup = new RosterLookup(repository);
        this.availabilityService = availabilityService;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    /**
     * Crowns a new champion.
     *
     * @param titleId  the title, which must be active
     * @param champion a wrestler or tag team that is currently bookable
     * @param wonAt    date the title changed hands; {@code null} means now
     * @return the new reign
     * @throws ChampionshipException if the title or the champion is not eligible
     */
    public TitleChampionship awardTitle(String titleId, EntityRef champion, Instant wonAt) {
        if (!champion.type().canHoldTitles()) {
            throw new ChampionshipException(titleId, "A " + champion.type().getLabel() + " cannot hold a title");
        }
        Instant date = wonAt != null ? wonAt : clock.instant();

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forChampionship(correlationId, titleId)) {
            TitleChampionship reign = unitOfWork.execute(correlationId, () -> lockSet(titleId, champion), ctx -> {
                Title title = lookup.title(titleId);
                lookup.member(champion);
                if (!availabilityService.isTitleActive(titleId)) {
                    throw new ChampionshipException(titleId, "Title '" + title.getName()
                            + "' is not active, only an active title can be awarded");
                }
                if (!availabilityService.isBookable(champion)) {
                    throw new ChampionshipException(titleId, champion + " is not available to win a title");
                }

                Optional<TitleChampionship> current = repository.currentChampionship(titleId);
                if (current.isPresent()) {
                    TitleChampionship previous = current.get();
                    if (previous.champion().equals(champion)) {
                        throw new ChampionshipException(titleId, champion + " already holds '" + title.getName() + "'");
                    }
                    if (!date.isAfter(previous.wonAt())) {
                        throw new ChampionshipException(titleId, "New reign at " + date
                                + " must start after the current reign began " + previous.wonAt());
                    }
                    ctx.transaction().execute("end reign " + previous.id(),
                            () -> repository.endOpenChampionship(titleId, date),
                            ended -> repository.updateChampionship(previous));
                }

                TitleChampionship created = ctx.transaction().execute("award " + titleId + " to " + champion,
                        () -> repository.createChampionship(titleId, champion, date),
                        c -> repository.deleteChampionship(c.id()));
                ctx.audit(AuditAction.CHAMPIONSHIP_CHANGED, EntityRef.title(titleId), clock.instant(), Map.of(
                        "change", "awarded",
                        "champion", champion.key(),
                        "wonAt", date.toString()));
                return created;
            });
            log.info("championship.awarded titleId={} champion={} wonAt={}", titleId, champion, date);
            return reign;
        }
    }

    /**
     * Vacates the title, ending the current reign.
     *
     * @return the ended reign, or empty if the title was already vacant
     */
    public Optional<TitleChampionship> vacateTitle(String titleId, Instant lostAt) {
        Instant date = lostAt != null ? lostAt : clock.instant();

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forChampionship(correlationId, titleId)) {
            return unitOfWork.execute(correlationId, () -> lockSet(titleId, null), ctx -> {
                lookup.title(titleId);
                Optional<TitleChampionship> current = repository.currentChampionship(titleId);
                if (current.isEmpty()) {
                    return Optional.<TitleChampionship>empty();
                }
                TitleChampionship reign = current.get();
                if (date.isBefore(reign.wonAt())) {
                    throw new ChampionshipException(titleId, "Reign cannot end at " + date
                            + ", it began " + reign.wonAt());
                }
                Optional<TitleChampionship> ended = ctx.transaction().execute("vacate " + titleId,
                        () -> repository.endOpenChampionship(titleId, date),
                        e -> repository.updateChampionship(reign));
                ctx.audit(AuditAction.CHAMPIONSHIP_CHANGED, EntityRef.title(titleId), clock.instant(), Map.of(
                        "change", "vacated",
                        "champion", reign.champion().key(),
                        "lostAt", date.toString()));
                log.info("championship.vacated titleId={} champion={} lostAt={}", titleId, reign.champion(), date);
                return ended;
            });
        }
    }

    // the title, the incoming champion and the outgoing one
    private Set<EntityRef> lockSet(String titleId, EntityRef champion) {
        Set<EntityRef> refs = new LinkedHashSet<>();
        refs.add(EntityRef.title(titleId));
        if (champion != null) {
            refs.add(champion);
        }
        repository.currentChampionship(titleId).ifPresent(reign -> refs.add(reign.champion()));
        return refs;
    }

    public Optional<EntityRef> currentChampion(String titleId) {
        lookup.title(titleId);
        return repository.currentChampionship(titleId).map(TitleChampionship::champion);
    }

    /**
     * All reigns of a title, oldest first.
     */
    public List<TitleChampionship> history(String titleId) {
        lookup.title(titleId);
        return repository.findChampionships(titleId);
    }

    /**
     * Length of the current reign in whole days.
     *
     * @throws EntityNotFoundException if the title is vacant
     */
    public long reignLengthInDays(String titleId) {
        return repository.currentChampionship(titleId)
                .map(reign -> reign.reignLengthInDays(clock.instant()))
                .orElseThrow(() -> EntityNotFoundException.championship(titleId));
    }

    /**
     * The longest reign in the title's history; ties go to the earlier reign.
     */
    public Optional<ReignSummary> longestReign(String titleId) {
        Instant now = clock.instant();
        return history(titleId).stream()
                .max(Comparator.comparingLong((TitleChampionship reign) -> reign.reignLengthInDays(now))
                        .thenComparing(TitleChampionship::wonAt, Comparator.reverseOrder()))
                .map(reign -> new ReignSummary(
                        reign.champion(),
                        repository.findMember(reign.champion().id()).map(RosterMember::getName).orElse(reign.champion().id()),
                        reign.reignLengthInDays(now),
                        reign.wonAt(),
                        reign.lostAt()));
    }
}
