package com.ringside.roster.championship;

import com.ringside.roster.core.model.EntityRef;

import java.time.Instant;

/**
 * A title reign with its champion's display name and length in days.
 * {@code lostAt} is null for the current reign.
 */
public record ReignSummary(
        EntityRef champion,
        String championName,
        long days,
        Instant wonAt,
        Instant lostAt
) {
}
