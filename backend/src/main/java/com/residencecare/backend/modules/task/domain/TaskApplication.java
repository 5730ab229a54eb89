package com.residencecare.backend.modules.task.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.residencecare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A template applied to a resident. {@code selectedStatusText} is a copy of the template
 * label taken when the row was last written.
 */
@Entity
@Table(name = "task_application")
public class TaskApplication extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "residence_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID residenceId;

    @Column(name = "resident_id", nullable = false, columnDefinition = "uuid")
    private UUID residentId;

    @Column(name = "task_template_id", nullable = false, columnDefinition = "uuid")
    private UUID taskTemplateId;

    @Column(name = "applied_by", nullable = false, columnDefinition = "uuid")
    private UUID appliedBy;

    @Column(name = "applied_at", nullable = false)
    private OffsetDateTime appliedAt;

    @Column(name = "selected_status_index")
    private Integer selectedStatusIndex;

    @Column(name = "selected_status_text", length = 100)
    private String selectedStatusText;

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public UUID getResidenceId() {
        return residenceId;
    }

    public void setResidenceId(UUID residenceId) {
        this.residenceId = residenceId;
    }

    public UUID getResidentId() {
        return residentId;
    }

    public void setResidentId(UUID residentId) {
        this.residentId = residentId;
    }

    public UUID getTaskTemplateId() {
        return taskTemplateId;
    }

    public void setTaskTemplateId(UUID taskTemplateId) {
        this.taskTemplateId = taskTemplateId;
    }

    public UUID getAppliedBy() {
        return appliedBy;
    }

    public void setAppliedBy(UUID appliedBy) {
        this.appliedBy = appliedBy;
    }

    public OffsetDateTime getAppliedAt() {
        return appliedAt;
    }

    public void setAppliedAt(OffsetDateTime appliedAt) {
        this.appliedAt = appliedAt;
    }

    public Integer getSelectedStatusIndex() {
        return selectedStatusIndex;
    }

    public void setSelectedStatusIndex(Integer selectedStatusIndex) {
        this.selectedStatusIndex = selectedStatusIndex;
    }

    public String getSelectedStatusText() {
        return selectedStatusText;
    }

    public void setSelectedStatusText(String selectedStatusText) {
        this.selectedStatusText = selectedStatusText;
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", format(id));
        snapshot.put("residence_id", format(residenceId));
        snapshot.put("resident_id", format(residentId));
        snapshot.put("task_template_id", format(taskTemplateId));
        snapshot.put("applied_by", format(appliedBy));
        snapshot.put("applied_at", format(appliedAt));
        snapshot.put("selected_status_index", selectedStatusIndex);
        snapshot.put("selected_status_text", selectedStatusText);
        snapshot.put("created_at", format(getCreatedAt()));
        snapshot.put("updated_at", format(getUpdatedAt()));
        snapshot.put("deleted_at", format(getDeletedAt()));
        return snapshot;
    }
}
