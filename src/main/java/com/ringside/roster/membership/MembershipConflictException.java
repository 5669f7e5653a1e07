package com.ringside.roster.membership;

import com.ringside.roster.core.RosterException;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.Membership;
import com.ringside.roster.core.model.MembershipKind;

import java.time.Instant;

/**
 * Raised when attaching or detaching a membership would break a membership rule.
 */
public class MembershipConflictException extends RosterException {

    private final MembershipKind kind;
    private final EntityRef member;

    public MembershipConflictException(MembershipKind kind, EntityRef member, String message) {
        super(message);
        this.kind = kind;
        this.member = member;
    }

    public static MembershipConflictException alreadyMember(MembershipKind kind, EntityRef group, EntityRef member) {
        return new MembershipConflictException(kind, member, member + " is already a current " + describe(kind)
                + " of " + group);
    }

    public static MembershipConflictException alreadyInAnotherGroup(MembershipKind kind, EntityRef member,
                                                                    Membership existing) {
        return new MembershipConflictException(kind, member, member + " is already a current " + describe(kind)
                + " of " + existing.group() + " since " + existing.joinedAt());
    }

    public static MembershipConflictException groupFull(MembershipKind kind, EntityRef group, EntityRef member,
                                                        int limit) {
        return new MembershipConflictException(kind, member, group + " already has " + limit + " current partners");
    }

    public static MembershipConflictException joinedBeforeLastLeave(MembershipKind kind, EntityRef member,
                                                                    Instant joinedAt, Instant lastLeftAt) {
        return new MembershipConflictException(kind, member, member + " cannot join at " + joinedAt
                + ", its previous " + describe(kind) + " membership ended " + lastLeftAt);
    }

    public static MembershipConflictException leftBeforeJoin(Membership membership, Instant leftAt) {
        return new MembershipConflictException(membership.kind(), membership.member(), membership.member()
                + " cannot leave " + membership.group() + " at " + leftAt + ", it joined " + membership.joinedAt());
    }

    public static MembershipConflictException groupRetired(MembershipKind kind, EntityRef group, EntityRef member) {
        return new MembershipConflictException(kind, member, member + " cannot join " + group
                + ", it is retired");
    }

    public static MembershipConflictException unsupportedMember(MembershipKind kind, EntityRef member) {
        return new MembershipConflictException(kind, member,
                "A " + member.type().getLabel() + " cannot be a " + describe(kind));
    }

    public MembershipKind getKind() {
        return kind;
    }

    public EntityRef getMember() {
        return member;
    }

    private static String describe(MembershipKind kind) {
        return switch (kind) {
            case TAG_TEAM_PARTNER -> "tag team partner";
            case STABLE_MEMBER -> "stable member";
            case MANAGEMENT -> "managed client";
        };
    }
}
