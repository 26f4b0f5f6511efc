package com.discussboard.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * Entity removed by stamping {@code deleted_at}. Queries must filter {@code deletedAt is null}.
 */
@MappedSuperclass
public abstract class AbstractSoftDeletableEntity extends AbstractTimestampedEntity {

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public void markDeleted(OffsetDateTime now) {
        this.deletedAt = now;
    }

    public void restore() {
        this.deletedAt = null;
    }
}
