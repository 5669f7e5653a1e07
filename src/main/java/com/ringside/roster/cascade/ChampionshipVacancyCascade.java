package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.TitleChampionship;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.ledger.LedgerInvariantException;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.transition.TransitionTransaction;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A champion who is released or retires vacates every title they hold.
 * The titles themselves keep their status.
 */
public class ChampionshipVacancyCascade implements CascadeStrategy {

    private final RosterRepository repository;

    public ChampionshipVacancyCascade(RosterRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return "championship-vacancy";
    }

    @Override
    public Set<Transition> triggers() {
        return Set.of(Transition.RELEASE, Transition.RETIRE);
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.WRESTLER, EntityType.TAG_TEAM);
    }

    @Override
    public int apply(CascadeContext context) {
        List<TitleChampionship> reigns = repository.openChampionshipsHeldBy(context.subject());
        for (TitleChampionship reign : reigns) {
            endReign(context.transaction(), repository, reign, context.effectiveDate());
        }
        return reigns.size();
    }

    static TitleChampionship endReign(TransitionTransaction tx, RosterRepository repository,
                                      TitleChampionship reign, Instant lostAt) {
        if (lostAt.isBefore(reign.wonAt())) {
            throw new LedgerInvariantException("Championship " + reign.id() + " on title " + reign.titleId()
                    + " cannot end at " + lostAt + ", it was won " + reign.wonAt());
        }
        return tx.execute("end championship " + reign.id(),
                        () -> repository.endOpenChampionship(reign.titleId(), lostAt),
                        ended -> repository.updateChampionship(reign))
                .orElse(reign.withLostAt(lostAt));
    }
}
