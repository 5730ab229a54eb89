package com.residencecare.backend.modules.device.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.residencecare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "device")
public class Device extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "residence_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID residenceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private DeviceType type;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "mac", nullable = false, length = 32)
    private String mac;

    @Column(name = "battery_percent")
    private Integer batteryPercent;

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

    public DeviceType getType() {
        return type;
    }

    public void setType(DeviceType type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMac() {
        return mac;
    }

    public void setMac(String mac) {
        this.mac = mac;
    }

    public Integer getBatteryPercent() {
        return batteryPercent;
    }

    public void setBatteryPercent(Integer batteryPercent) {
        this.batteryPercent = batteryPercent;
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", format(id));
        snapshot.put("residence_id", format(residenceId));
        snapshot.put("type", format(type));
        snapshot.put("name", name);
        snapshot.put("mac", mac);
        snapshot.put("battery_percent", batteryPercent);
        snapshot.put("created_at", format(getCreatedAt()));
        snapshot.put("updated_at", format(getUpdatedAt()));
        snapshot.put("deleted_at", format(getDeletedAt()));
        return snapshot;
    }
}
