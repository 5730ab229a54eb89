package com.residencecare.backend.global.jpa;

import java.time.OffsetDateTime;

import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * Created/updated timestamps and the soft-delete marker shared by every store entity.
 * There are no setters for the timestamps: only the lifecycle engine stamps them.
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity implements LifecycleEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @Override
    public void stampCreated(OffsetDateTime now) {
        this.createdAt = now;
        this.updatedAt = now;
    }

    @Override
    public void stampModified(OffsetDateTime now) {
        this.updatedAt = now;
    }

    @Override
    public void softDelete(OffsetDateTime now) {
        if (deletedAt == null) {
            deletedAt = now;
        }
    }

    public void restore() {
        deletedAt = null;
    }

    @Override
    public boolean isDeleted() {
        return deletedAt != null;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    protected static String format(Object value) {
        return value != null ? value.toString() : null;
    }
}
