package com.ringside.roster.ledger;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Period;
import com.ringside.roster.core.model.PeriodHistory;
import com.ringside.roster.core.model.PeriodKind;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.transition.TransitionTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only ledger of employment, suspension, injury, retirement and
 * activation periods.
 *
 * <p>Invariants enforced on every write:</p>
 * <ul>
 *   <li>at most one open period per (owner, kind)</li>
 *   <li>{@code startedAt < endedAt} once a period is closed</li>
 *   <li>periods of the same kind never overlap</li>
 * </ul>
 * Every write is registered with the caller's {@link TransitionTransaction}
 * together with its inverse.
 */
public class PeriodLedger {
    private static final Logger log = LoggerFactory.getLogger(PeriodLedger.class);

    private final RosterRepository repository;

    public PeriodLedger(RosterRepository repository) {
        this.repository = repository;
    }

    /**
     * Loads the full period history of an owner.
     */
    public PeriodHistory history(EntityRef owner) {
        return PeriodHistory.of(owner, repository.findPeriods(owner));
    }

    /**
     * Opens a new period of the given kind.
     *
     * @throws LedgerInvariantException if a period of that kind is already open or
     *                                  the new period would overlap a closed one
     */
    public Period open(TransitionTransaction tx, EntityRef owner, PeriodKind kind, Instant startedAt, String notes) {
        Optional<Period> current = repository.currentPeriod(owner, kind);
        if (current.isPresent()) {
            throw LedgerInvariantException.alreadyOpen(owner, current.get());
        }
        checkNoOverlap(owner, kind, startedAt);

        Period period = tx.execute("open " + kind + " for " + owner,
                () -> repository.createPeriod(owner, kind, startedAt, notes),
                created -> repository.deletePeriod(created.id()));
        log.debug("ledger.opened owner={} kind={} startedAt={}", owner, kind, startedAt);
        return period;
    }

    /**
     * Closes the open period of the given kind. Closing when nothing is open is a no-op.
     *
     * @throws LedgerInvariantException if {@code endedAt} does not follow the period start
     */
    public Optional<Period> close(TransitionTransaction tx, EntityRef owner, PeriodKind kind, Instant endedAt) {
        Optional<Period> current = repository.currentPeriod(owner, kind);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Period open = current.get();
        if (!endedAt.isAfter(open.startedAt())) {
            throw LedgerInvariantException.endNotAfterStart(open, endedAt);
        }

        Optional<Period> closed = tx.execute("close " + kind + " for " + owner,
                () -> repository.endOpenPeriod(owner, kind, endedAt),
                ended -> repository.updatePeriod(open));
        log.debug("ledger.closed owner={} kind={} endedAt={}", owner, kind, endedAt);
        return closed;
    }

    /**
     * Moves the start of the open period of the given kind, used when a
     * future-dated employment or activation is brought forward or pushed back.
     */
    public Period reschedule(TransitionTransaction tx, EntityRef owner, PeriodKind kind, Instant startedAt) {
        Period open = repository.currentPeriod(owner, kind)
                .orElseThrow(() -> LedgerInvariantException.noOpenPeriod(owner, kind));
        checkNoOverlap(owner, kind, startedAt);

        Period rescheduled = tx.execute("reschedule " + kind + " for " + owner,
                () -> repository.updatePeriod(open.withStartedAt(startedAt)),
                updated -> repository.updatePeriod(open));
        log.debug("ledger.rescheduled owner={} kind={} from={} to={}", owner, kind, open.startedAt(), startedAt);
        return rescheduled;
    }

    private void checkNoOverlap(EntityRef owner, PeriodKind kind, Instant startedAt) {
        List<Period> previous = repository.previousPeriods(owner, kind);
        for (Period closed : previous) {
            if (startedAt.isBefore(closed.endedAt())) {
                throw LedgerInvariantException.overlaps(owner, kind, startedAt, closed);
            }
        }
    }
}
