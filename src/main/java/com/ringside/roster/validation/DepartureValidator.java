package com.ringside.roster.validation;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.EntityType;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.TitleChampionship;
import com.ringside.roster.repository.RosterRepository;
import com.ringside.roster.transition.CannotTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rejects a departure dated before a reign or membership that the departure
 * cascades would have to end. Runs before any write so a backdated release or
 * retirement is refused as a transition rather than failing mid-cascade.
 */
public class DepartureValidator implements TransitionValidator {

    private final RosterRepository repository;

    public DepartureValidator(RosterRepository repository) {
        this.repository = repository;
    }

    @Override
    public void validate(ValidationContext context) {
        EntityRef subject = context.subject();
        Instant date = context.effectiveDate();

        for (TitleChampionship reign : reignsEndedBy(subject)) {
            if (date.isBefore(reign.wonAt())) {
                throw reject(context, "effective date " + date + " precedes the reign on title '"
                        + reign.titleId() + "' won " + reign.wonAt());
            }
        }

        for (Membership membership : membershipsEndedBy(subject)) {
            if (date.isBefore(membership.joinedAt())) {
                EntityRef other = membership.group().equals(subject) ? membership.member() : membership.group();
                throw reject(context, "effective date " + date + " precedes the "
                        + membership.kind().name().toLowerCase() + " with " + other
                        + " joined " + membership.joinedAt());
            }
        }
    }

    private List<TitleChampionship> reignsEndedBy(EntityRef subject) {
        if (subject.type() == EntityType.TITLE) {
            return repository.currentChampionship(subject.id()).map(List::of).orElse(List.of());
        }
        if (subject.type().canHoldTitles()) {
            return repository.openChampionshipsHeldBy(subject);
        }
        return List.of();
    }

    private List<Membership> membershipsEndedBy(EntityRef subject) {
        List<Membership> rows = new ArrayList<>();
        switch (subject.type()) {
            case WRESTLER -> {
                rows.addAll(repository.openMembershipsOfMember(MembershipKind.TAG_TEAM_PARTNER, subject));
                rows.addAll(repository.openMembershipsOfMember(MembershipKind.STABLE_MEMBER, subject));
                rows.addAll(repository.openMembershipsOfMember(MembershipKind.MANAGEMENT, subject));
            }
            case TAG_TEAM -> {
                rows.addAll(repository.openMembershipsOfMember(MembershipKind.STABLE_MEMBER, subject));
                rows.addAll(repository.openMembershipsOfMember(MembershipKind.MANAGEMENT, subject));
            }
            case MANAGER -> {
                rows.addAll(repository.openMembershipsOfMember(MembershipKind.STABLE_MEMBER, subject));
                rows.addAll(repository.openMembershipsOfGroup(MembershipKind.MANAGEMENT, subject));
            }
            case STABLE -> rows.addAll(repository.openMembershipsOfGroup(MembershipKind.STABLE_MEMBER, subject));
            default -> {
                // referees and titles belong to no group
            }
        }
        return rows;
    }

    private CannotTransitionException reject(ValidationContext context, String reason) {
        return new CannotTransitionException(context.transition(), context.subject(),
                context.currentStatus().name(), reason);
    }
}
