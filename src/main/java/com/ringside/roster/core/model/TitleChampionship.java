package com.ringside.roster.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One title reign. The champion is either a wrestler or a tag team.
 */
public record TitleChampionship(
        String id,
        String titleId,
        EntityRef champion,
        Instant wonAt,
        Instant lostAt
) {
    public TitleChampionship {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(titleId, "titleId is required");
        Objects.requireNonNull(champion, "champion is required");
        Objects.requireNonNull(wonAt, "wonAt is required");
        if (!champion.type().canHoldTitles()) {
            throw new IllegalArgumentException("A " + champion.type().getLabel() + " cannot hold a title");
        }
    }

    public boolean isCurrent() {
        return lostAt == null;
    }

    /**
     * Length of the reign in whole days, measured to {@code now} while the title is still held.
     */
    public long reignLengthInDays(Instant now) {
        Instant end = lostAt != null ? lostAt : now;
        return Math.max(0, Duration.between(wonAt, end).toDays());
    }

    public TitleChampionship withLostAt(Instant lostAt) {
        return new TitleChampionship(id, titleId, champion, wonAt, lostAt);
    }
}
