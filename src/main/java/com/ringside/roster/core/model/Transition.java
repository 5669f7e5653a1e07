package com.ringside.roster.core.model;

import java.util.List;

/**
 * Lifecycle transitions and the ledger effects each one has.
 *
 * <p>{@link #closes()} lists the period kinds ended by the transition, in the
 * order they must be ended. {@link #opens()} lists the kinds it starts.</p>
 */
public enum Transition {
    EMPLOY("employ", List.of(), List.of(PeriodKind.EMPLOYMENT)),
    RELEASE("release", List.of(PeriodKind.SUSPENSION, PeriodKind.EMPLOYMENT), List.of()),
    SUSPEND("suspend", List.of(), List.of(PeriodKind.SUSPENSION)),
    REINSTATE("reinstate", List.of(PeriodKind.SUSPENSION), List.of()),
    INJURE("injure", List.of(), List.of(PeriodKind.INJURY)),
    CLEAR_INJURY("clearInjury", List.of(PeriodKind.INJURY), List.of()),
    RETIRE("retire",
            List.of(PeriodKind.SUSPENSION, PeriodKind.INJURY, PeriodKind.EMPLOYMENT, PeriodKind.ACTIVATION),
            List.of(PeriodKind.RETIREMENT)),
    UNRETIRE("unretire", List.of(PeriodKind.RETIREMENT), List.of()),
    ACTIVATE("activate", List.of(), List.of(PeriodKind.ACTIVATION)),
    DEACTIVATE("deactivate", List.of(PeriodKind.ACTIVATION), List.of());

    private final String label;
    private final List<PeriodKind> closes;
    private final List<PeriodKind> opens;

    Transition(String label, List<PeriodKind> closes, List<PeriodKind> opens) {
        this.label = label;
        this.closes = closes;
        this.opens = opens;
    }

    public String getLabel() {
        return label;
    }

    public List<PeriodKind> closes() {
        return closes;
    }

    public List<PeriodKind> opens() {
        return opens;
    }

    /**
     * Release and retirement end a member's involvement with the promotion
     * and trigger relationship cascades.
     */
    public boolean isDeparture() {
        return this == RELEASE || this == RETIRE;
    }
}
