package com.ringside.roster.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A wrestler, referee, manager or tag team.
 *
 * <p>The {@code status} field is a cache of what the status projector computes
 * from the member's periods. Only transition actions write it, through
 * {@link Builder#status(EmploymentStatus)} on a copy.</p>
 */
public class RosterMember {
    private final String id;
    private final EntityType type;
    private final String name;
    private final EmploymentStatus status;
    private final Instant createdAt;
    private final Instant deletedAt;

    private RosterMember(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.name = builder.name;
        this.status = builder.status != null ? builder.status : EmploymentStatus.UNEMPLOYED;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.deletedAt = builder.deletedAt;
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public EmploymentStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public EntityRef ref() {
        return EntityRef.of(type, id);
    }

    public boolean hasStatus(EmploymentStatus candidate) {
        return status == candidate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RosterMember that = (RosterMember) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RosterMember{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", name='" + name + '\'' +
                ", status=" + status +
                (deletedAt != null ? ", deletedAt=" + deletedAt : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(RosterMember member) {
        return new Builder()
                .id(member.id)
                .type(member.type)
                .name(member.name)
                .status(member.status)
                .createdAt(member.createdAt)
                .deletedAt(member.deletedAt);
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String name;
        private EmploymentStatus status;
        private Instant createdAt;
        private Instant deletedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(EmploymentStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public RosterMember build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            if (!type.isRosterMember()) {
                throw new IllegalArgumentException("Not a roster member type: " + type);
            }
            return new RosterMember(this);
        }
    }
}
