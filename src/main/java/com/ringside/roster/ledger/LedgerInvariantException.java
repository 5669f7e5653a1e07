package com.ringside.roster.ledger;

import com.ringside.roster.core.RosterException;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodKind;

import java.time.Instant;

/**
 * Raised when a ledger write would break a period invariant. Validators should make
 * this impossible; seeing it means an unexpected state and the transition is halted.
 */
public class LedgerInvariantException extends RosterException {

    public LedgerInvariantException(String message) {
        super(message);
    }

    public static LedgerInvariantException alreadyOpen(EntityRef owner, Period open) {
        return new LedgerInvariantException(owner + " already has an open " + open.kind()
                + " period (" + open.id() + ") started " + open.startedAt());
    }

    public static LedgerInvariantException endNotAfterStart(Period period, Instant endedAt) {
        return new LedgerInvariantException(period.kind() + " period " + period.id() + " of " + period.owner()
                + " cannot end at " + endedAt + ", it started " + period.startedAt());
    }

    public static LedgerInvariantException overlaps(EntityRef owner, PeriodKind kind, Instant startedAt,
                                                    Period previous) {
        return new LedgerInvariantException(kind + " period of " + owner + " starting " + startedAt
                + " overlaps period " + previous.id() + " which ended " + previous.endedAt());
    }

    public static LedgerInvariantException noOpenPeriod(EntityRef owner, PeriodKind kind) {
        return new LedgerInvariantException(owner + " has no open " + kind + " period");
    }
}
