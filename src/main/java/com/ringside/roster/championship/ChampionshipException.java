package com.ringside.roster.championship;

import com.ringside.roster.core.RosterException;

/**
 * Raised when a title cannot change hands: the title is not active, the
 * challenger is not available, or the reign dates are out of order.
 */
public class ChampionshipException extends RosterException {

    private final String titleId;

    public ChampionshipException(String titleId, String message) {
        super(message);
        this.titleId = titleId;
    }

    public String getTitleId() {
        return titleId;
    }
}
