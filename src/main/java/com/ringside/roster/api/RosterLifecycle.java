package com.ringside.roster.api;

import com.ringside.roster.audit.AuditRepository;
import com.ringside.roster.audit.AuditService;
import com.ringside.roster.availability.AvailabilityService;
import com.ringside.roster.cascade.CascadeEngine;
import com.ringside.roster.cascade.CascadeStrategy;
import com.ringside.roster.cascade.ChampionshipVacancyCascade;
import com.ringside.roster.cascade.ManagementCascade;
import com.ringside.roster.cascade.ManagerEmploymentCascade;
import com.ringside.roster.cascade.PartnerEmploymentCascade;
import com.ringside.roster.cascade.StableDepartureCascade;
import com.ringside.roster.cascade.StableRetirementCascade;
import com.ringside.roster.cascade.TagTeamDepartureCascade;
import com.ringside.roster.cascade.TitleRetirementCascade;
import com.ringside.roster.championship.ChampionshipService;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.PeriodHistory;
import com.ringside.roster.ledger.PeriodLedger;
import com.ringside.roster.lock.EntityLock;
import com.ringside.roster.lock.LocalEntityLock;
import com.ringside.roster.membership.MembershipService;
import com.ringside.roster.membership.MembershipWriter;
import com.ringside.roster.metrics.MetricsService;
import com.ringside.roster.metrics.NoOpMetricsService;
import com.ringside.roster.repository.InMemoryRosterRepository;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.roster.RosterService;
import com.ringside.roster.status.StatusProjector;
import com.ringside.roster.transition.TransitionEngine;
import com.ringside.roster.transition.UnitOfWork;
import com.ringside.roster.validation.TransitionValidators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for the roster lifecycle library.
 * Provides a fluent API over transitions, memberships, championships and roster maintenance.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * RosterLifecycle roster = RosterLifecycle.builder()
 *     .clock(Clock.systemUTC())
 *     .build();
 *
 * RosterMember wrestler = roster.roster().createMember(EntityType.WRESTLER, "Rey Mysterio");
 * roster.wrestlers().employ(wrestler.getId(), Instant.parse("2024-01-01T00:00:00Z"));
 * roster.wrestlers().suspend(wrestler.getId(), Instant.parse("2024-02-01T00:00:00Z"));
 * roster.wrestlers().retire(wrestler.getId(), Instant.parse("2024-03-01T00:00:00Z"), "Hall of Fame");
 * </pre>
 */
public class RosterLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RosterLifecycle.class);

    private final RosterRepository repository;
    private final PeriodLedger ledger;
    private final AuditService auditService;
    private final TransitionEngine transitionEngine;
    private final MemberTransitions wrestlers;
    private final MemberTransitions referees;
    private final MemberTransitions managers;
    private final MemberTransitions tagTeams;
    private final TitleTransitions titles;
    private final StableTransitions stables;
    private final MembershipService membershipService;
    private final ChampionshipService championshipService;
    private final AvailabilityService availabilityService;
    private final RosterService rosterService;
    private final RosterOptions options;

    private RosterLifecycle(Builder builder) {
        this.options = builder.options;
        this.repository = builder.repository != null ? builder.repository : new InMemoryRosterRepository();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        EntityLock lock = builder.entityLock != null ? builder.entityLock : new LocalEntityLock();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditRepository != null
                ? new AuditService(builder.auditRepository) : new AuditService();

        this.ledger = new PeriodLedger(repository);
        StatusProjector projector = new StatusProjector();
        UnitOfWork unitOfWork = new UnitOfWork(lock, auditService, options.getActorId());
        MembershipWriter membershipWriter = new MembershipWriter(repository,
                options.getRequiredTagTeamPartners(), options.isEnforceSingleStableMembership());

        TransitionValidators validators = TransitionValidators.defaults(
                options.getRequiredTagTeamPartners(), repository, ledger, projector);
        CascadeEngine cascadeEngine = new CascadeEngine(
                cascades(repository, ledger, membershipWriter, options), metricsService);
        this.transitionEngine = new TransitionEngine(repository, ledger, projector, validators, cascadeEngine,
                unitOfWork, auditService, metricsService, clock);

        this.wrestlers = new MemberTransitions(EntityType.WRESTLER, transitionEngine);
        this.referees = new MemberTransitions(EntityType.REFEREE, transitionEngine);
        this.managers = new MemberTransitions(EntityType.MANAGER, transitionEngine);
        this.tagTeams = new MemberTransitions(EntityType.TAG_TEAM, transitionEngine);
        this.titles = new TitleTransitions(transitionEngine);
        this.stables = new StableTransitions(transitionEngine);

        this.availabilityService = new AvailabilityService(repository, ledger, projector, clock,
                options.getRequiredTagTeamPartners());
        this.membershipService = new MembershipService(repository, membershipWriter, unitOfWork, clock);
        this.championshipService = new ChampionshipService(repository, availabilityService, unitOfWork, clock);
        this.rosterService = new RosterService(repository, membershipWriter, transitionEngine, unitOfWork,
                auditService, clock);

        log.info("RosterLifecycle initialized with {}", options);
    }

    private static List<CascadeStrategy> cascades(RosterRepository repository, PeriodLedger ledger,
                                                  MembershipWriter membershipWriter, RosterOptions options) {
        List<CascadeStrategy> strategies = new ArrayList<>();
        strategies.add(new ChampionshipVacancyCascade(repository));
        strategies.add(new TagTeamDepartureCascade(repository, membershipWriter,
                options.getRequiredTagTeamPartners()));
        strategies.add(new StableDepartureCascade(repository, membershipWriter));
        strategies.add(new ManagementCascade(repository, membershipWriter));
        strategies.add(new TitleRetirementCascade(repository));
        strategies.add(new StableRetirementCascade(repository, membershipWriter));
        if (options.isCascadeEmploymentToPartners()) {
            strategies.add(new PartnerEmploymentCascade(repository, ledger));
        }
        if (options.isCascadeEmploymentToManagers()) {
            strategies.add(new ManagerEmploymentCascade(repository, ledger));
        }
        return strategies;
    }

    public MemberTransitions wrestlers() {
        return wrestlers;
    }

    public MemberTransitions referees() {
        return referees;
    }

    public MemberTransitions managers() {
        return managers;
    }

    public MemberTransitions tagTeams() {
        return tagTeams;
    }

    /**
     * Transitions for any roster member type.
     */
    public MemberTransitions members(EntityType type) {
        return switch (type) {
            case WRESTLER -> wrestlers;
            case REFEREE -> referees;
            case MANAGER -> managers;
            case TAG_TEAM -> tagTeams;
            default -> throw new IllegalArgumentException(type.getLabel() + " is not a roster member");
        };
    }

    public TitleTransitions titles() {
        return titles;
    }

    public StableTransitions stables() {
        return stables;
    }

    public MembershipService memberships() {
        return membershipService;
    }

    public ChampionshipService championships() {
        return championshipService;
    }

    public AvailabilityService availability() {
        return availabilityService;
    }

    public RosterService roster() {
        return rosterService;
    }

    public AuditService auditService() {
        return auditService;
    }

    /**
     * Full period history of a member, title or stable.
     */
    public PeriodHistory history(EntityRef ref) {
        return ledger.history(ref);
    }

    public RosterRepository getRepository() {
        return repository;
    }

    public RosterOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RosterRepository repository;
        private Clock clock;
        private EntityLock entityLock;
        private MetricsService metricsService;
        private AuditRepository auditRepository;
        private RosterOptions options = RosterOptions.defaults();

        /**
         * Sets the storage implementation.
         * Defaults to {@link InMemoryRosterRepository} if not set.
         */
        public Builder repository(RosterRepository repository) {
            this.repository = repository;
            return this;
        }

        /**
         * Sets the clock that supplies "now" for defaulted effective dates and status projection.
         * Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the per-entity lock.
         * Defaults to {@link LocalEntityLock} if not set.
         */
        public Builder entityLock(EntityLock lock) {
            this.entityLock = lock;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom audit repository for persistence.
         * If set, the AuditService will use this repository instead of the default in-memory one.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder options(RosterOptions options) {
            this.options = options;
            return this;
        }

        public RosterLifecycle build() {
            if (options == null) {
                throw new IllegalStateException("RosterOptions are required");
            }
            return new RosterLifecycle(this);
        }
    }
}
