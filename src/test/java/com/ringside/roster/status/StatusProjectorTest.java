package com.ringside.roster.status;

import com.ringside.roster.core.model.EmploymentStatus;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodHistory;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.core.model.StableStatus;
import com.ringside.roster.core.model.TitleStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatusProjector Tests")
class StatusProjectorTest {

    private static final EntityRef WRESTLER = EntityRef.wrestler("w-1");
    private static final EntityRef TITLE = EntityRef.title("t-1");
    private static final EntityRef STABLE = EntityRef.stable("s-1");
    private static final Instant NOW = at("2025-01-01");

    private final StatusProjector projector = new StatusProjector();
    private final List<Period> periods = new ArrayList<>();

    private static Instant at(String date) {
        return Instant.parse(date + "T00:00:00Z");
    }

    private void period(EntityRef owner, PeriodKind kind, String start, String end) {
        periods.add(new Period("p-" + periods.size(), owner, kind, at(start), end != null ? at(end) : null, null));
    }

    private EmploymentStatus member() {
        return projector.project(PeriodHistory.of(WRESTLER, periods), NOW);
    }

    private TitleStatus title() {
        return projector.projectTitle(PeriodHistory.of(TITLE, periods), NOW);
    }

    private StableStatus stable() {
        return projector.projectStable(PeriodHistory.of(STABLE, periods), NOW);
    }

    @Nested
    @DisplayName("Roster members")
    class MemberProjection {

        @Test
        @DisplayName("No periods projects to Unemployed")
        void noPeriods() {
            assertEquals(EmploymentStatus.UNEMPLOYED, member());
        }

        @Test
        @DisplayName("Open employment that has started projects to Employed")
        void openEmployment() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", null);
            assertEquals(EmploymentStatus.EMPLOYED, member());
        }

        @Test
        @DisplayName("Employment starting after now projects to Future Employment")
        void futureEmployment() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2025-02-01", null);
            assertEquals(EmploymentStatus.FUTURE_EMPLOYED, member());
        }

        @Test
        @DisplayName("Employment starting exactly now is already Employed")
        void employmentStartingNow() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2025-01-01", null);
            assertEquals(EmploymentStatus.EMPLOYED, member());
        }

        @Test
        @DisplayName("Closed latest employment projects to Released")
        void released() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", "2024-06-01");
            assertEquals(EmploymentStatus.RELEASED, member());
        }

        @Test
        @DisplayName("Open injury on top of employment projects to Injured")
        void injured() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", null);
            period(WRESTLER, PeriodKind.INJURY, "2024-03-01", null);
            assertEquals(EmploymentStatus.INJURED, member());
        }

        @Test
        @DisplayName("Open suspension on top of employment projects to Suspended")
        void suspended() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", null);
            period(WRESTLER, PeriodKind.SUSPENSION, "2024-03-01", null);
            assertEquals(EmploymentStatus.SUSPENDED, member());
        }

        @Test
        @DisplayName("Injury is checked before suspension")
        void injuryWinsOverSuspension() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", null);
            period(WRESTLER, PeriodKind.SUSPENSION, "2024-03-01", null);
            period(WRESTLER, PeriodKind.INJURY, "2024-04-01", null);
            assertEquals(EmploymentStatus.INJURED, member());
        }

        @Test
        @DisplayName("Closed injuries and suspensions do not count")
        void closedSideStatuses() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", null);
            period(WRESTLER, PeriodKind.SUSPENSION, "2024-02-01", "2024-02-15");
            period(WRESTLER, PeriodKind.INJURY, "2024-03-01", "2024-04-01");
            assertEquals(EmploymentStatus.EMPLOYED, member());
        }

        @Test
        @DisplayName("Open retirement projects to Retired whatever else is present")
        void retired() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", "2024-03-01");
            period(WRESTLER, PeriodKind.RETIREMENT, "2024-03-01", null);
            assertEquals(EmploymentStatus.RETIRED, member());
        }

        @Test
        @DisplayName("Ended retirement projects to Unemployed, not to the old employment")
        void unretired() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", "2024-03-01");
            period(WRESTLER, PeriodKind.RETIREMENT, "2024-03-01", "2024-05-01");
            assertEquals(EmploymentStatus.UNEMPLOYED, member());
        }

        @Test
        @DisplayName("Released, retired, then unretired projects to Unemployed")
        void releasedThenRetiredThenUnretired() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", "2024-02-01");
            period(WRESTLER, PeriodKind.RETIREMENT, "2024-03-01", "2024-05-01");
            assertEquals(EmploymentStatus.UNEMPLOYED, member());
        }

        @Test
        @DisplayName("Employment after an ended retirement is projected normally")
        void reEmployedAfterRetirement() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", "2024-03-01");
            period(WRESTLER, PeriodKind.RETIREMENT, "2024-03-01", "2024-05-01");
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-06-01", null);
            assertEquals(EmploymentStatus.EMPLOYED, member());
        }

        @Test
        @DisplayName("Release after a comeback projects to Released")
        void releasedAfterComeback() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", "2024-03-01");
            period(WRESTLER, PeriodKind.RETIREMENT, "2024-03-01", "2024-05-01");
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-06-01", "2024-08-01");
            assertEquals(EmploymentStatus.RELEASED, member());
        }

        @Test
        @DisplayName("Projection is idempotent")
        void idempotent() {
            period(WRESTLER, PeriodKind.EMPLOYMENT, "2024-01-01", null);
            period(WRESTLER, PeriodKind.SUSPENSION, "2024-03-01", null);
            PeriodHistory history = PeriodHistory.of(WRESTLER, periods);

            EmploymentStatus first = projector.project(history, NOW);
            assertEquals(first, projector.project(history, NOW));
            assertEquals(first, projector.project(PeriodHistory.of(WRESTLER, periods), NOW));
        }
    }

    @Nested
    @DisplayName("Titles")
    class TitleProjection {

        @Test
        @DisplayName("No activation projects to Unactivated")
        void unactivated() {
            assertEquals(TitleStatus.UNACTIVATED, title());
        }

        @Test
        @DisplayName("Activation starting after now projects to Pending Activation")
        void pending() {
            period(TITLE, PeriodKind.ACTIVATION, "2025-03-01", null);
            assertEquals(TitleStatus.PENDING_ACTIVATION, title());
        }

        @Test
        @DisplayName("Open activation projects to Active")
        void active() {
            period(TITLE, PeriodKind.ACTIVATION, "2024-01-01", null);
            assertEquals(TitleStatus.ACTIVE, title());
        }

        @Test
        @DisplayName("Closed activation projects to Inactive")
        void inactive() {
            period(TITLE, PeriodKind.ACTIVATION, "2024-01-01", "2024-06-01");
            assertEquals(TitleStatus.INACTIVE, title());
        }

        @Test
        @DisplayName("Open retirement projects to Retired; ended retirement back to Inactive")
        void retiredAndUnretired() {
            period(TITLE, PeriodKind.ACTIVATION, "2024-01-01", "2024-06-01");
            period(TITLE, PeriodKind.RETIREMENT, "2024-06-01", null);
            assertEquals(TitleStatus.RETIRED, title());

            periods.set(1, periods.get(1).withEndedAt(at("2024-09-01")));
            assertEquals(TitleStatus.INACTIVE, title());
        }
    }

    @Nested
    @DisplayName("Stables")
    class StableProjection {

        @Test
        @DisplayName("A stable moves from Unactivated through Pending Debut to Active")
        void debut() {
            assertEquals(StableStatus.UNACTIVATED, stable());

            period(STABLE, PeriodKind.ACTIVATION, "2025-03-01", null);
            assertEquals(StableStatus.PENDING_DEBUT, stable());

            periods.set(0, new Period("p-0", STABLE, PeriodKind.ACTIVATION, at("2024-03-01"), null, null));
            assertEquals(StableStatus.ACTIVE, stable());
        }

        @Test
        @DisplayName("Closed activation projects to Disbanded; open retirement to Retired")
        void disbandedAndRetired() {
            period(STABLE, PeriodKind.ACTIVATION, "2024-01-01", "2024-06-01");
            assertEquals(StableStatus.DISBANDED, stable());

            period(STABLE, PeriodKind.RETIREMENT, "2024-06-01", null);
            assertEquals(StableStatus.RETIRED, stable());
        }
    }
}
