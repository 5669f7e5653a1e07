package com.ringside.roster.cascade;

import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Transition;
import com.ringside.roster.repository.RosterRepository;

import java.util.Set;

/**
 * Retiring a title ends its current reign. The champion's own status is untouched.
 */
public class TitleRetirementCascade implements CascadeStrategy {

    private final RosterRepository repository;

    public TitleRetirementCascade(RosterRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return "title-retirement";
    }

    @Override
    public Set<Transition> triggers() {
        return Set.of(Transition.RETIRE);
    }

    @Override
    public Set<EntityType> subjectTypes() {
        return Set.of(EntityType.TITLE);
    }

    @Override
    public int apply(CascadeContext context) {
        return repository.currentChampionship(context.subject().id())
                .map(reign -> {
                    ChampionshipVacancyCascade.endReign(context.transaction(), repository, reign,
                            context.effectiveDate());
                    return 1;
                })
                .orElse(0);
    }
}
