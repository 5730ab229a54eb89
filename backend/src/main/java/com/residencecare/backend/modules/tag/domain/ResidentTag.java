package com.residencecare.backend.modules.tag.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/**
 * Pure association row: hard-deleted on unassignment and never historized.
 */
@Entity
@Table(name = "resident_tag")
public class ResidentTag {

    @EmbeddedId
    private ResidentTagId id;

    @Column(name = "assigned_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID assignedBy;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private OffsetDateTime assignedAt;

    protected ResidentTag() {
    }

    public ResidentTagId getId() {
        return id;
    }

    public UUID getAssignedBy() {
        return assignedBy;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }
}
