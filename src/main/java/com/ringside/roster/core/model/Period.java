package com.ringside.roster.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One time-bounded period in the ledger. A null {@code endedAt} marks the
 * period as open (current).
 */
public record Period(
        String id,
        EntityRef owner,
        PeriodKind kind,
        Instant startedAt,
        Instant endedAt,
        String notes
) {
    public Period {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(owner, "owner is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
    }

    public boolean isOpen() {
        return endedAt == null;
    }

    public boolean isClosed() {
        return endedAt != null;
    }

    /**
     * Whether the period has started by the given instant.
     */
    public boolean hasStartedBy(Instant instant) {
        return !startedAt.isAfter(instant);
    }

    public Period withEndedAt(Instant endedAt) {
        return new Period(id, owner, kind, startedAt, endedAt, notes);
    }

    public Period withStartedAt(Instant startedAt) {
        return new Period(id, owner, kind, startedAt, endedAt, notes);
    }
}
