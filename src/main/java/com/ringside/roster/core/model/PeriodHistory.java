package com.ringside.roster.core.model;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete period history of one entity, grouped by kind and ordered by start.
 */
public final class PeriodHistory {

    private final EntityRef owner;
    private final Map<PeriodKind, List<Period>> periods;

    private PeriodHistory(EntityRef owner, Map<PeriodKind, List<Period>> periods) {
        this.owner = owner;
        this.periods = periods;
    }

    public static PeriodHistory of(EntityRef owner, List<Period> periods) {
        Objects.requireNonNull(owner, "owner is required");
        Map<PeriodKind, List<Period>> byKind = new EnumMap<>(PeriodKind.class);
        for (PeriodKind kind : PeriodKind.values()) {
            byKind.put(kind, periods.stream()
                    .filter(p -> p.kind() == kind)
                    .sorted(Comparator.comparing(Period::startedAt))
                    .toList());
        }
        return new PeriodHistory(owner, byKind);
    }

    public static PeriodHistory empty(EntityRef owner) {
        return of(owner, List.of());
    }

    public EntityRef owner() {
        return owner;
    }

    public List<Period> of(PeriodKind kind) {
        return periods.get(kind);
    }

    public boolean isEmpty(PeriodKind kind) {
        return periods.get(kind).isEmpty();
    }

    /**
     * The open period of the given kind, if any.
     */
    public Optional<Period> current(PeriodKind kind) {
        return periods.get(kind).stream().filter(Period::isOpen).findFirst();
    }

    /**
     * The most recently started period of the given kind.
     */
    public Optional<Period> latest(PeriodKind kind) {
        List<Period> list = periods.get(kind);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
    }

    /**
     * The most recently started closed period of the given kind.
     */
    public Optional<Period> latestClosed(PeriodKind kind) {
        List<Period> list = periods.get(kind);
        for (int i = list.size() - 1; i >= 0; i--) {
            if (list.get(i).isClosed()) {
                return Optional.of(list.get(i));
            }
        }
        return Optional.empty();
    }

    public long openCount(PeriodKind kind) {
        return periods.get(kind).stream().filter(Period::isOpen).count();
    }
}
