package com.residencecare.backend.modules.history.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One append-only ledger row. The identity column is the per-ledger sequence; rows are
 * written once and every column is non-updatable.
 */
@MappedSuperclass
public abstract class AbstractHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "entity_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_kind", nullable = false, updatable = false, length = 8)
    private ChangeKind changeKind;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "snapshot", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> snapshot;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "previous_snapshot", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> previousSnapshot;

    @Column(name = "actor_id", updatable = false, columnDefinition = "uuid")
    private UUID actorId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private OffsetDateTime recordedAt;

    public Long getId() {
        return id;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public void setEntityId(UUID entityId) {
        this.entityId = entityId;
    }

    public ChangeKind getChangeKind() {
        return changeKind;
    }

    public void setChangeKind(ChangeKind changeKind) {
        this.changeKind = changeKind;
    }

    public Map<String, Object> getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Map<String, Object> snapshot) {
        this.snapshot = snapshot;
    }

    public Map<String, Object> getPreviousSnapshot() {
        return previousSnapshot;
    }

    public void setPreviousSnapshot(Map<String, Object> previousSnapshot) {
        this.previousSnapshot = previousSnapshot;
    }

    public UUID getActorId() {
        return actorId;
    }

    public void setActorId(UUID actorId) {
        this.actorId = actorId;
    }

    public OffsetDateTime getRecordedAt() {
        return recordedAt;
    }

    public void setRecordedAt(OffsetDateTime recordedAt) {
        this.recordedAt = recordedAt;
    }
}
