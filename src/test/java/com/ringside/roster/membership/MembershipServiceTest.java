package com.ringside.roster.membership;

import com.ringside.roster.audit.AuditAction;
import com.ringside.roster.audit.AuditService;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.RosterMember;
import com.ringside.roster.core.model.Stable;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.lock.LocalEntityLock;
import com.ringside.roster.repository.InMemoryRosterRepository;
import com.ringside.roster.transition.EntityNotFoundException;
import com.ringside.roster.transition.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MembershipService Tests")
class MembershipServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private InMemoryRosterRepository repository;
    private AuditService auditService;
    private MembershipService service;

    private static Instant at(String date) {
        return Instant.parse(date + "T00:00:00Z");
    }

    @BeforeEach
    void setUp() {
        repository = new InMemoryRosterRepository();
        auditService = new AuditService();
        service = service(true);
    }

    private MembershipService service(boolean singleStableMembership) {
        return new MembershipService(repository, new MembershipWriter(repository, 2, singleStableMembership),
                new UnitOfWork(new LocalEntityLock(), auditService, "SYSTEM"), CLOCK);
    }

    private RosterMember member(EntityType type, String name) {
        return repository.saveMember(RosterMember.builder().type(type).name(name).createdAt(CLOCK.instant()).build());
    }

    private Stable stable(String name) {
        return repository.saveStable(Stable.create(name, CLOCK.instant()));
    }

    @Nested
    @DisplayName("Tag team partners")
    class Partners {

        @Test
        @DisplayName("Should add partners and audit the change")
        void addPartners() {
            RosterMember team = member(EntityType.TAG_TEAM, "New Age Outlaws");
            RosterMember a = member(EntityType.WRESTLER, "Road Dogg");
            RosterMember b = member(EntityType.WRESTLER, "Billy Gunn");

            service.addTagTeamPartner(team.getId(), a.getId(), at("2024-01-01"));
            service.addTagTeamPartner(team.getId(), b.getId(), at("2024-01-02"));

            assertEquals(List.of(a.ref(), b.ref()), service.currentPartners(team.getId()));
            var audit = auditService.getEntriesByAction(AuditAction.MEMBERSHIP_CHANGED);
            assertEquals(2, audit.size());
            assertEquals("joined", audit.get(0).details().get("change"));
            assertEquals(team.ref().key(), audit.get(0).details().get("group"));
        }

        @Test
        @DisplayName("Should reject a partner beyond the team size")
        void teamFull() {
            RosterMember team = member(EntityType.TAG_TEAM, "Legion of Doom");
            service.addTagTeamPartner(team.getId(), member(EntityType.WRESTLER, "Hawk").getId(), at("2024-01-01"));
            service.addTagTeamPartner(team.getId(), member(EntityType.WRESTLER, "Animal").getId(), at("2024-01-01"));
            RosterMember third = member(EntityType.WRESTLER, "Puke");

            assertThrows(MembershipConflictException.class,
                    () -> service.addTagTeamPartner(team.getId(), third.getId(), at("2024-02-01")));
            assertEquals(2, service.currentPartners(team.getId()).size());
        }

        @Test
        @DisplayName("Should reject a wrestler already in another team or already in this one")
        void alreadyPartnered() {
            RosterMember team1 = member(EntityType.TAG_TEAM, "Team One");
            RosterMember team2 = member(EntityType.TAG_TEAM, "Team Two");
            RosterMember w = member(EntityType.WRESTLER, "Owen");
            service.addTagTeamPartner(team1.getId(), w.getId(), at("2024-01-01"));

            MembershipConflictException e = assertThrows(MembershipConflictException.class,
                    () -> service.addTagTeamPartner(team2.getId(), w.getId(), at("2024-02-01")));
            assertEquals(MembershipKind.TAG_TEAM_PARTNER, e.getKind());
            assertEquals(w.ref(), e.getMember());
            assertThrows(MembershipConflictException.class,
                    () -> service.addTagTeamPartner(team1.getId(), w.getId(), at("2024-02-01")));
        }

        @Test
        @DisplayName("Should end a partnership and reject leaving twice")
        void removePartner() {
            RosterMember team = member(EntityType.TAG_TEAM, "Rockers");
            RosterMember w = member(EntityType.WRESTLER, "Marty");
            service.addTagTeamPartner(team.getId(), w.getId(), at("2024-01-01"));

            Membership ended = service.removeTagTeamPartner(team.getId(), w.getId(), at("2024-03-01"));

            assertEquals(at("2024-03-01"), ended.leftAt());
            assertTrue(service.currentPartners(team.getId()).isEmpty());
            assertThrows(EntityNotFoundException.class,
                    () -> service.removeTagTeamPartner(team.getId(), w.getId(), at("2024-04-01")));
        }

        @Test
        @DisplayName("Should reject leaving before joining")
        void leaveBeforeJoin() {
            RosterMember team = member(EntityType.TAG_TEAM, "Rockers");
            RosterMember w = member(EntityType.WRESTLER, "Shawn");
            service.addTagTeamPartner(team.getId(), w.getId(), at("2024-03-01"));

            assertThrows(MembershipConflictException.class,
                    () -> service.removeTagTeamPartner(team.getId(), w.getId(), at("2024-02-01")));
            assertEquals(1, service.currentPartners(team.getId()).size());
        }
    }

    @Nested
    @DisplayName("Stables")
    class Stables {

        @Test
        @DisplayName("Should allow wrestlers, tag teams and managers but not referees")
        void memberTypes() {
            Stable stable = stable("Four Horsemen");
            service.joinStable(stable.id(), member(EntityType.WRESTLER, "Ric").ref(), at("2024-01-01"));
            service.joinStable(stable.id(), member(EntityType.TAG_TEAM, "Minnesota Wrecking Crew").ref(),
                    at("2024-01-01"));
            service.joinStable(stable.id(), member(EntityType.MANAGER, "JJ").ref(), at("2024-01-01"));
            EntityRef referee = member(EntityType.REFEREE, "Earl").ref();

            assertThrows(MembershipConflictException.class,
                    () -> service.joinStable(stable.id(), referee, at("2024-01-01")));
            assertEquals(3, service.currentStableMembers(stable.id()).size());
        }

        @Test
        @DisplayName("Should enforce a single current stable when configured")
        void singleStable() {
            Stable nwo = stable("nWo");
            Stable wolfpac = stable("Wolfpac");
            EntityRef kevin = member(EntityType.WRESTLER, "Kevin").ref();
            service.joinStable(nwo.id(), kevin, at("2024-01-01"));

            assertThrows(MembershipConflictException.class,
                    () -> service.joinStable(wolfpac.id(), kevin, at("2024-02-01")));

            MembershipService relaxed = service(false);
            assertDoesNotThrow(() -> relaxed.joinStable(wolfpac.id(), kevin, at("2024-02-01")));
        }

        @Test
        @DisplayName("Should reject joining before the previous membership ended")
        void joinBeforeLastLeave() {
            Stable nwo = stable("nWo");
            Stable wolfpac = stable("Wolfpac");
            EntityRef scott = member(EntityType.WRESTLER, "Scott").ref();
            service.joinStable(nwo.id(), scott, at("2024-01-01"));
            service.leaveStable(nwo.id(), scott, at("2024-06-01"));

            assertThrows(MembershipConflictException.class,
                    () -> service.joinStable(wolfpac.id(), scott, at("2024-05-01")));
            assertDoesNotThrow(() -> service.joinStable(wolfpac.id(), scott, at("2024-06-01")));
            assertEquals(2, service.history(scott).size());
        }

        @Test
        @DisplayName("Should reject joining a retired stable")
        void retiredStable() {
            Stable stable = repository.saveStable(Stable.create("Ministry", CLOCK.instant())
                    .withStatus(StableStatus.RETIRED));
            EntityRef w = member(EntityType.WRESTLER, "Bradshaw").ref();

            MembershipConflictException e = assertThrows(MembershipConflictException.class,
                    () -> service.joinStable(stable.id(), w, at("2024-01-01")));
            assertTrue(e.getMessage().contains("retired"));
            assertTrue(service.currentStableMembers(stable.id()).isEmpty());
        }

        @Test
        @DisplayName("Should report a missing stable as not found")
        void missingStable() {
            EntityRef w = member(EntityType.WRESTLER, "Nobody").ref();

            assertThrows(EntityNotFoundException.class, () -> service.joinStable("missing", w, at("2024-01-01")));
            assertTrue(auditService.getAllEntries().isEmpty());
        }
    }

    @Nested
    @DisplayName("Managers")
    class Managers {

        @Test
        @DisplayName("A client may have several managers")
        void severalManagers() {
            RosterMember m1 = member(EntityType.MANAGER, "Heenan");
            RosterMember m2 = member(EntityType.MANAGER, "Sherri");
            RosterMember w = member(EntityType.WRESTLER, "Rude");

            service.assignManager(m1.getId(), w.ref(), at("2024-01-01"));
            service.assignManager(m2.getId(), w.ref(), at("2024-02-01"));

            assertEquals(List.of(m1.ref(), m2.ref()), service.currentManagers(w.ref()));
            assertEquals(List.of(w.ref()), service.currentClients(m1.getId()));
        }

        @Test
        @DisplayName("Removing a manager defaults the date to now")
        void removeManager() {
            RosterMember m = member(EntityType.MANAGER, "Jimmy");
            RosterMember team = member(EntityType.TAG_TEAM, "Wild Samoans");
            service.assignManager(m.getId(), team.ref(), at("2024-01-01"));

            Membership ended = service.removeManager(m.getId(), team.ref(), null);

            assertEquals(CLOCK.instant(), ended.leftAt());
            assertTrue(service.currentClients(m.getId()).isEmpty());
        }

        @Test
        @DisplayName("Referees cannot be managed")
        void refereeNotManaged() {
            RosterMember m = member(EntityType.MANAGER, "Jimmy");
            RosterMember referee = member(EntityType.REFEREE, "Hebner");

            assertThrows(MembershipConflictException.class,
                    () -> service.assignManager(m.getId(), referee.ref(), at("2024-01-01")));
        }
    }
}
