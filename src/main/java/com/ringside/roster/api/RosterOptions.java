package com.ringside.roster.api;

/**
 * Options for roster lifecycle operations.
 * Configures tag-team size, membership rules and employment cascades.
 */
public class RosterOptions {

    private static final int DEFAULT_REQUIRED_TAG_TEAM_PARTNERS = 2;

    private final int requiredTagTeamPartners;
    private final boolean enforceSingleStableMembership;
    private final boolean cascadeEmploymentToPartners;
    private final boolean cascadeEmploymentToManagers;
    private final String actorId;

    private RosterOptions(Builder builder) {
        this.requiredTagTeamPartners = builder.requiredTagTeamPartners;
        this.enforceSingleStableMembership = builder.enforceSingleStableMembership;
        this.cascadeEmploymentToPartners = builder.cascadeEmploymentToPartners;
        this.cascadeEmploymentToManagers = builder.cascadeEmploymentToManagers;
        this.actorId = builder.actorId;
    }

    /**
     * Partners a tag team needs to be employed and booked; also the most it may have.
     */
    public int getRequiredTagTeamPartners() {
        return requiredTagTeamPartners;
    }

    public boolean isEnforceSingleStableMembership() {
        return enforceSingleStableMembership;
    }

    public boolean isCascadeEmploymentToPartners() {
        return cascadeEmploymentToPartners;
    }

    public boolean isCascadeEmploymentToManagers() {
        return cascadeEmploymentToManagers;
    }

    /**
     * Actor recorded on audit entries.
     */
    public String getActorId() {
        return actorId;
    }

    /**
     * Creates default options.
     */
    public static RosterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int requiredTagTeamPartners = DEFAULT_REQUIRED_TAG_TEAM_PARTNERS;
        private boolean enforceSingleStableMembership = true;
        private boolean cascadeEmploymentToPartners = true;
        private boolean cascadeEmploymentToManagers = true;
        private String actorId = "SYSTEM";

        public Builder requiredTagTeamPartners(int requiredTagTeamPartners) {
            if (requiredTagTeamPartners <= 0) {
                throw new IllegalArgumentException("requiredTagTeamPartners must be positive");
            }
            this.requiredTagTeamPartners = requiredTagTeamPartners;
            return this;
        }

        public Builder enforceSingleStableMembership(boolean enforceSingleStableMembership) {
            this.enforceSingleStableMembership = enforceSingleStableMembership;
            return this;
        }

        public Builder cascadeEmploymentToPartners(boolean cascadeEmploymentToPartners) {
            this.cascadeEmploymentToPartners = cascadeEmploymentToPartners;
            return this;
        }

        public Builder cascadeEmploymentToManagers(boolean cascadeEmploymentToManagers) {
            this.cascadeEmploymentToManagers = cascadeEmploymentToManagers;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public RosterOptions build() {
            if (actorId == null || actorId.isBlank()) {
                throw new IllegalArgumentException("actorId is required");
            }
            return new RosterOptions(this);
        }
    }

    @Override
    public String toString() {
        return "RosterOptions{" +
                "requiredTagTeamPartners=" + requiredTagTeamPartners +
                ", enforceSingleStableMembership=" + enforceSingleStableMembership +
                ", cascadeEmploymentToPartners=" + cascadeEmploymentToPartners +
                ", cascadeEmploymentToManagers=" + cascadeEmploymentToManagers +
                ", actorId='" + actorId + '\'' +
                '}';
    }
}
