package com.ringside.roster.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A championship title. Its status is derived from activation and retirement periods.
 */
public class Title {
    private final String id;
    private final String name;
    private final TitleStatus status;
    private final Instant createdAt;
    private final Instant deletedAt;

    private Title(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name;
        this.status = builder.status != null ? builder.status : TitleStatus.UNACTIVATED;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.deletedAt = builder.deletedAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TitleStatus getStatus() {
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

    public boolean isActive() {
        return status == TitleStatus.ACTIVE;
    }

    public EntityRef ref() {
        return EntityRef.title(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Title title = (Title) o;
        return Objects.equals(id, title.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Title{id='" + id + "', name='" + name + "', status=" + status + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Title title) {
        return new Builder()
                .id(title.id)
                .name(title.name)
                .status(title.status)
                .createdAt(title.createdAt)
                .deletedAt(title.deletedAt);
    }

    public static class Builder {
        private String id;
        private String name;
        private TitleStatus status;
        private Instant createdAt;
        private Instant deletedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(TitleStatus status) {
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

        public Title build() {
            Objects.requireNonNull(name, "name is required");
            return new Title(this);
        }
    }
}
