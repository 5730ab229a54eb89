package com.residencecare.backend.modules.residence.domain;

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
@Table(name = "floor")
public class Floor extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "residence_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID residenceId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

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

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", format(id));
        snapshot.put("residence_id", format(residenceId));
        snapshot.put("name", name);
        snapshot.put("created_at", format(getCreatedAt()));
        snapshot.put("updated_at", format(getUpdatedAt()));
        snapshot.put("deleted_at", format(getDeletedAt()));
        return snapshot;
    }
}
