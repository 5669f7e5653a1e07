package com.ringside.roster.validation;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityFamily;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodHistory;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.core.model.TitleStatus;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.ledger.PeriodLedger;
import com.ringside.roster.repository.InMemoryRosterRepository;
import com.ringside.roster.status.StatusProjector;
import com.ringside.roster.transition.CannotTransitionException;
import com.ringside.roster.transition.TransitionTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransitionValidators Tests")
class TransitionValidatorsTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryRosterRepository repository;
    private PeriodLedger ledger;
    private TransitionValidators validators;

    private static Instant at(String date) {
        return Instant.parse(date + "T00:00:00Z");
    }

    @BeforeEach
    void setUp() {
        repository = new InMemoryRosterRepository();
        ledger = new PeriodLedger(repository);
        validators = TransitionValidators.defaults(2, repository, ledger, new StatusProjector());
    }

    private ValidationContext context(EntityRef subject, Transition transition, Enum<?> status,
                                      PeriodHistory history, Instant date) {
        return new ValidationContext(subject, transition, status, history, date, NOW);
    }

    private ValidationContext context(EntityRef subject, Transition transition, Enum<?> status) {
        return context(subject, transition, status, PeriodHistory.empty(subject), NOW);
    }

    @Nested
    @DisplayName("Dispatch table")
    class Table {

        @Test
        @DisplayName("Supports each family's own transitions only")
        void supports() {
            assertTrue(validators.supports(EntityFamily.INDIVIDUAL, Transition.INJURE));
            assertTrue(validators.supports(EntityFamily.TAG_TEAM, Transition.EMPLOY));
            assertTrue(validators.supports(EntityFamily.TITLE, Transition.ACTIVATE));
            assertFalse(validators.supports(EntityFamily.TITLE, Transition.EMPLOY));
            assertFalse(validators.supports(EntityFamily.TAG_TEAM, Transition.INJURE));
            assertFalse(validators.supports(EntityFamily.INDIVIDUAL, Transition.DEACTIVATE));
        }

        @Test
        @DisplayName("The legal-source check runs first")
        void legalSourceFirst() {
            List<TransitionValidator> employ = validators.validatorsFor(EntityFamily.TAG_TEAM, Transition.EMPLOY);

            assertEquals(3, employ.size());
            LegalStatusValidator legal = assertInstanceOf(LegalStatusValidator.class, employ.get(0));
            assertEquals(3, legal.getLegalSources().size());
            assertTrue(legal.allows(EmploymentStatus.FUTURE_EMPLOYED));
            assertFalse(legal.allows(EmploymentStatus.RETIRED));
        }

        @Test
        @DisplayName("An unsupported pair is rejected")
        void unsupported() {
            EntityRef team = EntityRef.tagTeam("tt-1");

            CannotTransitionException e = assertThrows(CannotTransitionException.class,
                    () -> validators.validate(context(team, Transition.INJURE, EmploymentStatus.EMPLOYED)));
            assertTrue(e.getMessage().contains("does not support"));
            assertEquals(Transition.INJURE, e.getTransition());
        }

        @Test
        @DisplayName("The validator list is read-only")
        void readOnly() {
            List<TransitionValidator> list = validators.validatorsFor(EntityFamily.TITLE, Transition.RETIRE);
            assertThrows(UnsupportedOperationException.class, () -> list.add(c -> { }));
            assertTrue(validators.validatorsFor(EntityFamily.TITLE, Transition.INJURE).isEmpty());
        }

        @Test
        @DisplayName("Custom validators run after the defaults")
        void register() {
            List<Transition> seen = new ArrayList<>();
            validators.register(EntityFamily.INDIVIDUAL, Transition.SUSPEND, c -> seen.add(c.transition()));
            EntityRef w = EntityRef.wrestler("w-1");

            validators.validate(context(w, Transition.SUSPEND, EmploymentStatus.EMPLOYED));
            assertEquals(List.of(Transition.SUSPEND), seen);

            assertThrows(CannotTransitionException.class,
                    () -> validators.validate(context(w, Transition.SUSPEND, EmploymentStatus.RELEASED)));
            assertEquals(1, seen.size());
        }
    }

    @Nested
    @DisplayName("Legal source statuses")
    class LegalSources {

        private final EntityRef wrestler = EntityRef.wrestler("w-1");
        private final EntityRef title = EntityRef.title("t-1");

        @Test
        @DisplayName("Member transitions")
        void memberTransitions() {
            assertTrue(validators.isAllowed(context(wrestler, Transition.EMPLOY, EmploymentStatus.UNEMPLOYED)));
            assertTrue(validators.isAllowed(context(wrestler, Transition.EMPLOY, EmploymentStatus.RELEASED)));
            assertFalse(validators.isAllowed(context(wrestler, Transition.EMPLOY, EmploymentStatus.EMPLOYED)));
            assertTrue(validators.isAllowed(context(wrestler, Transition.RELEASE, EmploymentStatus.SUSPENDED)));
            assertFalse(validators.isAllowed(context(wrestler, Transition.RELEASE, EmploymentStatus.INJURED)));
            assertFalse(validators.isAllowed(context(wrestler, Transition.SUSPEND, EmploymentStatus.INJURED)));
            assertTrue(validators.isAllowed(context(wrestler, Transition.REINSTATE, EmploymentStatus.SUSPENDED)));
            assertTrue(validators.isAllowed(context(wrestler, Transition.INJURE, EmploymentStatus.EMPLOYED)));
            assertFalse(validators.isAllowed(context(wrestler, Transition.CLEAR_INJURY, EmploymentStatus.EMPLOYED)));
            assertTrue(validators.isAllowed(context(wrestler, Transition.RETIRE, EmploymentStatus.RELEASED)));
            assertFalse(validators.isAllowed(context(wrestler, Transition.RETIRE, EmploymentStatus.INJURED)));
            assertFalse(validators.isAllowed(context(wrestler, Transition.UNRETIRE, EmploymentStatus.RELEASED)));
        }

        @Test
        @DisplayName("Title transitions")
        void titleTransitions() {
            assertTrue(validators.isAllowed(context(title, Transition.ACTIVATE, TitleStatus.UNACTIVATED)));
            assertTrue(validators.isAllowed(context(title, Transition.ACTIVATE, TitleStatus.PENDING_ACTIVATION)));
            assertFalse(validators.isAllowed(context(title, Transition.ACTIVATE, TitleStatus.ACTIVE)));
            assertFalse(validators.isAllowed(context(title, Transition.DEACTIVATE, TitleStatus.INACTIVE)));
            assertTrue(validators.isAllowed(context(title, Transition.RETIRE, TitleStatus.INACTIVE)));
            assertFalse(validators.isAllowed(context(title, Transition.RETIRE, TitleStatus.UNACTIVATED)));
            assertTrue(validators.isAllowed(context(title, Transition.UNRETIRE, TitleStatus.RETIRED)));
        }

        @Test
        @DisplayName("Stable transitions")
        void stableTransitions() {
            EntityRef stable = EntityRef.stable("s-1");

            assertTrue(validators.isAllowed(context(stable, Transition.ACTIVATE, StableStatus.UNACTIVATED)));
            assertTrue(validators.isAllowed(context(stable, Transition.ACTIVATE, StableStatus.DISBANDED)));
            assertFalse(validators.isAllowed(context(stable, Transition.ACTIVATE, StableStatus.RETIRED)));
            assertTrue(validators.isAllowed(context(stable, Transition.DEACTIVATE, StableStatus.ACTIVE)));
            assertTrue(validators.isAllowed(context(stable, Transition.RETIRE, StableStatus.DISBANDED)));
            assertFalse(validators.isAllowed(context(stable, Transition.RETIRE, StableStatus.UNACTIVATED)));
            assertTrue(validators.isAllowed(context(stable, Transition.UNRETIRE, StableStatus.RETIRED)));
            assertFalse(validators.supports(EntityFamily.STABLE, Transition.EMPLOY));
        }

        @Test
        @DisplayName("Rejection carries the current status")
        void rejectionStatus() {
            CannotTransitionException e = assertThrows(CannotTransitionException.class,
                    () -> validators.validate(context(wrestler, Transition.REINSTATE, EmploymentStatus.EMPLOYED)));

            assertEquals("EMPLOYED", e.getCurrentStatus());
            assertEquals(wrestler, e.getSubject());
        }
    }

    @Nested
    @DisplayName("Chronology")
    class Chronology {

        private final EntityRef wrestler = EntityRef.wrestler("w-1");
        private final ChronologyValidator chronology = new ChronologyValidator();

        private PeriodHistory history(Period... periods) {
            return PeriodHistory.of(wrestler, List.of(periods));
        }

        @Test
        @DisplayName("A close date must be after the open period's start")
        void closeAfterStart() {
            PeriodHistory history = history(
                    new Period("p-1", wrestler, PeriodKind.EMPLOYMENT, at("2024-03-01"), null, null));

            assertThrows(CannotTransitionException.class, () -> chronology.validate(
                    context(wrestler, Transition.RELEASE, EmploymentStatus.EMPLOYED, history, at("2024-03-01"))));
            assertThrows(CannotTransitionException.class, () -> chronology.validate(
                    context(wrestler, Transition.RELEASE, EmploymentStatus.EMPLOYED, history, at("2024-02-01"))));
            assertDoesNotThrow(() -> chronology.validate(
                    context(wrestler, Transition.RELEASE, EmploymentStatus.EMPLOYED, history, at("2024-03-02"))));
        }

        @Test
        @DisplayName("An open date must not precede the previous period's end")
        void openAfterPreviousEnd() {
            PeriodHistory history = history(
                    new Period("p-1", wrestler, PeriodKind.EMPLOYMENT, at("2024-01-01"), at("2024-06-01"), null));

            assertThrows(CannotTransitionException.class, () -> chronology.validate(
                    context(wrestler, Transition.EMPLOY, EmploymentStatus.RELEASED, history, at("2024-05-01"))));
            assertDoesNotThrow(() -> chronology.validate(
                    context(wrestler, Transition.EMPLOY, EmploymentStatus.RELEASED, history, at("2024-06-01"))));
        }

        @Test
        @DisplayName("Employment must not start inside a past retirement")
        void employAfterRetirement() {
            PeriodHistory history = history(
                    new Period("p-1", wrestler, PeriodKind.EMPLOYMENT, at("2020-01-01"), at("2022-01-01"), null),
                    new Period("p-2", wrestler, PeriodKind.RETIREMENT, at("2022-01-01"), at("2024-01-01"), null));

            CannotTransitionException e = assertThrows(CannotTransitionException.class, () -> chronology.validate(
                    context(wrestler, Transition.EMPLOY, EmploymentStatus.UNEMPLOYED, history, at("2023-01-01"))));
            assertTrue(e.getMessage().contains("retirement"));
            assertDoesNotThrow(() -> chronology.validate(
                    context(wrestler, Transition.EMPLOY, EmploymentStatus.UNEMPLOYED, history, at("2024-02-01"))));
        }

        @Test
        @DisplayName("Suspension and injury must not precede the employment start")
        void suspendAndInjureAfterEmploymentStart() {
            PeriodHistory history = history(
                    new Period("p-1", wrestler, PeriodKind.EMPLOYMENT, at("2024-03-01"), null, null));

            for (Transition transition : List.of(Transition.SUSPEND, Transition.INJURE)) {
                CannotTransitionException e = assertThrows(CannotTransitionException.class, () -> chronology.validate(
                        context(wrestler, transition, EmploymentStatus.EMPLOYED, history, at("2024-02-01"))));
                assertTrue(e.getMessage().contains("employment start"));
                assertDoesNotThrow(() -> chronology.validate(
                        context(wrestler, transition, EmploymentStatus.EMPLOYED, history, at("2024-03-01"))));
            }
        }

        @Test
        @DisplayName("Retiring after a release must not precede the release")
        void retireAfterRelease() {
            PeriodHistory history = history(
                    new Period("p-1", wrestler, PeriodKind.EMPLOYMENT, at("2024-01-01"), at("2024-06-01"), null));

            assertThrows(CannotTransitionException.class, () -> chronology.validate(
                    context(wrestler, Transition.RETIRE, EmploymentStatus.RELEASED, history, at("2024-05-01"))));
            assertDoesNotThrow(() -> chronology.validate(
                    context(wrestler, Transition.RETIRE, EmploymentStatus.RELEASED, history, at("2024-06-01"))));
        }
    }

    @Nested
    @DisplayName("Departures")
    class Departures {

        private final EntityRef wrestler = EntityRef.wrestler("w-1");
        private final EntityRef manager = EntityRef.manager("m-1");

        private ValidationContext departure(EntityRef subject, Transition transition, Enum<?> status, String date) {
            return context(subject, transition, status, PeriodHistory.empty(subject), at(date));
        }

        @Test
        @DisplayName("Release must not precede a reign the champion still holds")
        void releaseBeforeReign() {
            repository.createChampionship("t-1", wrestler, at("2024-03-01"));

            CannotTransitionException e = assertThrows(CannotTransitionException.class, () -> validators.validate(
                    departure(wrestler, Transition.RELEASE, EmploymentStatus.EMPLOYED, "2024-02-01")));
            assertTrue(e.getMessage().contains("'t-1'"));
            assertTrue(validators.isAllowed(
                    departure(wrestler, Transition.RELEASE, EmploymentStatus.EMPLOYED, "2024-03-01")));
        }

        @Test
        @DisplayName("Departure must not precede a partnership or stable the member still belongs to")
        void departureBeforeJoin() {
            repository.attachMembership(MembershipKind.TAG_TEAM_PARTNER, EntityRef.tagTeam("tt-1"), wrestler,
                    at("2024-04-01"));

            assertFalse(validators.isAllowed(
                    departure(wrestler, Transition.RETIRE, EmploymentStatus.EMPLOYED, "2024-03-01")));

            EntityRef team = EntityRef.tagTeam("tt-2");
            repository.attachMembership(MembershipKind.STABLE_MEMBER, EntityRef.stable("s-1"), team, at("2024-05-01"));
            CannotTransitionException e = assertThrows(CannotTransitionException.class, () -> validators.validate(
                    departure(team, Transition.RELEASE, EmploymentStatus.EMPLOYED, "2024-04-01")));
            assertTrue(e.getMessage().contains("STABLE:s-1"));
        }

        @Test
        @DisplayName("A departing manager must not precede any client assignment")
        void managerBeforeClient() {
            repository.attachMembership(MembershipKind.MANAGEMENT, manager, wrestler, at("2024-04-01"));

            assertFalse(validators.isAllowed(
                    departure(manager, Transition.RELEASE, EmploymentStatus.EMPLOYED, "2024-03-01")));
            assertTrue(validators.isAllowed(
                    departure(manager, Transition.RELEASE, EmploymentStatus.EMPLOYED, "2024-04-01")));
        }

        @Test
        @DisplayName("Retiring a title or disbanding a stable must not precede what it ends")
        void titleAndStable() {
            EntityRef title = EntityRef.title("t-2");
            repository.createChampionship("t-2", wrestler, at("2024-03-01"));
            EntityRef stable = EntityRef.stable("s-2");
            repository.attachMembership(MembershipKind.STABLE_MEMBER, stable, wrestler, at("2024-03-01"));

            assertFalse(validators.isAllowed(departure(title, Transition.RETIRE, TitleStatus.ACTIVE, "2024-02-01")));
            assertFalse(validators.isAllowed(
                    departure(stable, Transition.DEACTIVATE, StableStatus.ACTIVE, "2024-02-01")));
            assertFalse(validators.isAllowed(departure(stable, Transition.RETIRE, StableStatus.ACTIVE, "2024-02-01")));
            assertTrue(validators.isAllowed(departure(stable, Transition.RETIRE, StableStatus.ACTIVE, "2024-03-01")));
        }
    }

    @Nested
    @DisplayName("Tag team partners")
    class Partners {

        private RosterMember team;
        private RosterMember first;
        private RosterMember second;

        @BeforeEach
        void setUpTeam() {
            team = repository.saveMember(RosterMember.builder().type(EntityType.TAG_TEAM).name("Dudleyz")
                    .createdAt(NOW).build());
            first = repository.saveMember(RosterMember.builder().type(EntityType.WRESTLER).name("Bubba")
                    .createdAt(NOW).build());
            second = repository.saveMember(RosterMember.builder().type(EntityType.WRESTLER).name("D-Von")
                    .createdAt(NOW).build());
        }

        private void partner(RosterMember wrestler) {
            repository.attachMembership(MembershipKind.TAG_TEAM_PARTNER, team.ref(), wrestler.ref(), at("2024-01-01"));
        }

        private void open(RosterMember owner, PeriodKind kind, String start) {
            TransitionTransaction tx = new TransitionTransaction();
            ledger.open(tx, owner.ref(), kind, at(start), null);
            tx.markSuccess();
            tx.close();
        }

        @Test
        @DisplayName("Employment needs a full team")
        void fullTeam() {
            partner(first);
            ValidationContext employ = context(team.ref(), Transition.EMPLOY, EmploymentStatus.UNEMPLOYED);

            CannotTransitionException e = assertThrows(CannotTransitionException.class,
                    () -> validators.validate(employ));
            assertTrue(e.getMessage().contains("1 current partners, 2 required"));

            partner(second);
            assertDoesNotThrow(() -> validators.validate(employ));
        }

        @Test
        @DisplayName("Suspension and retirement need partners who are neither injured nor suspended")
        void availablePartners() {
            ValidationContext suspend = context(team.ref(), Transition.SUSPEND, EmploymentStatus.EMPLOYED);
            ValidationContext retire = context(team.ref(), Transition.RETIRE, EmploymentStatus.EMPLOYED);

            assertFalse(validators.isAllowed(suspend));

            partner(first);
            partner(second);
            open(first, PeriodKind.EMPLOYMENT, "2024-01-01");
            open(second, PeriodKind.EMPLOYMENT, "2024-01-01");
            assertTrue(validators.isAllowed(suspend));

            open(second, PeriodKind.INJURY, "2024-06-01");
            CannotTransitionException e = assertThrows(CannotTransitionException.class,
                    () -> validators.validate(retire));
            assertTrue(e.getMessage().contains("'D-Von'"));
            assertFalse(validators.isAllowed(suspend));
        }

        @Test
        @DisplayName("Release does not look at partners")
        void releaseIgnoresPartners() {
            assertTrue(validators.isAllowed(context(team.ref(), Transition.RELEASE, EmploymentStatus.EMPLOYED)));
        }
    }
}
