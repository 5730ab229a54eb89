package com.residencecare.backend.modules.task.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.residencecare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "task_template")
public class TaskTemplate extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "residence_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID residenceId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "status1", length = 100)
    private String status1;

    @Column(name = "status2", length = 100)
    private String status2;

    @Column(name = "status3", length = 100)
    private String status3;

    @Column(name = "status4", length = 100)
    private String status4;

    @Column(name = "status5", length = 100)
    private String status5;

    @Column(name = "status6", length = 100)
    private String status6;

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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getStatusLabel(TaskStatusSlot slot) {
        return switch (slot) {
            case STATUS_1 -> status1;
            case STATUS_2 -> status2;
            case STATUS_3 -> status3;
            case STATUS_4 -> status4;
            case STATUS_5 -> status5;
            case STATUS_6 -> status6;
        };
    }

    public void setStatusLabel(TaskStatusSlot slot, String label) {
        switch (slot) {
            case STATUS_1 -> status1 = label;
            case STATUS_2 -> status2 = label;
            case STATUS_3 -> status3 = label;
            case STATUS_4 -> status4 = label;
            case STATUS_5 -> status5 = label;
            case STATUS_6 -> status6 = label;
        }
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", format(id));
        snapshot.put("residence_id", format(residenceId));
        snapshot.put("name", name);
        for (TaskStatusSlot slot : TaskStatusSlot.values()) {
            snapshot.put("status" + slot.index(), getStatusLabel(slot));
        }
        snapshot.put("created_at", format(getCreatedAt()));
        snapshot.put("updated_at", format(getUpdatedAt()));
        snapshot.put("deleted_at", format(getDeletedAt()));
        return snapshot;
    }
}
