package com.residencecare.backend.modules.measurement.domain;

import java.time.OffsetDateTime;
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
@Table(name = "measurement")
public class Measurement extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "residence_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID residenceId;

    @Column(name = "resident_id", nullable = false, columnDefinition = "uuid")
    private UUID residentId;

    @Column(name = "recorded_by", nullable = false, columnDefinition = "uuid")
    private UUID recordedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private MeasurementSource source;

    @Column(name = "device_id", columnDefinition = "uuid")
    private UUID deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private MeasurementType type;

    @Column(name = "systolic")
    private Integer systolic;

    @Column(name = "diastolic")
    private Integer diastolic;

    @Column(name = "pulse_bpm")
    private Integer pulseBpm;

    @Column(name = "spo2")
    private Integer spo2;

    @Column(name = "weight_kg")
    private Double weightKg;

    @Column(name = "temperature_c")
    private Double temperatureC;

    @Column(name = "taken_at", nullable = false)
    private OffsetDateTime takenAt;

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

    public UUID getRecordedBy() {
        return recordedBy;
    }

    public void setRecordedBy(UUID recordedBy) {
        this.recordedBy = recordedBy;
    }

    public MeasurementSource getSource() {
        return source;
    }

    public void setSource(MeasurementSource source) {
        this.source = source;
    }

    public UUID getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(UUID deviceId) {
        this.deviceId = deviceId;
    }

    public MeasurementType getType() {
        return type;
    }

    public void setType(MeasurementType type) {
        this.type = type;
    }

    public Integer getSystolic() {
        return systolic;
    }

    public void setSystolic(Integer systolic) {
        this.systolic = systolic;
    }

    public Integer getDiastolic() {
        return diastolic;
    }

    public void setDiastolic(Integer diastolic) {
        this.diastolic = diastolic;
    }

    public Integer getPulseBpm() {
        return pulseBpm;
    }

    public void setPulseBpm(Integer pulseBpm) {
        this.pulseBpm = pulseBpm;
    }

    public Integer getSpo2() {
        return spo2;
    }

    public void setSpo2(Integer spo2) {
        this.spo2 = spo2;
    }

    public Double getWeightKg() {
        return weightKg;
    }

    public void setWeightKg(Double weightKg) {
        this.weightKg = weightKg;
    }

    public Double getTemperatureC() {
        return temperatureC;
    }

    public void setTemperatureC(Double temperatureC) {
        this.temperatureC = temperatureC;
    }

    public OffsetDateTime getTakenAt() {
        return takenAt;
    }

    public void setTakenAt(OffsetDateTime takenAt) {
        this.takenAt = takenAt;
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", format(id));
        snapshot.put("residence_id", format(residenceId));
        snapshot.put("resident_id", format(residentId));
        snapshot.put("recorded_by", format(recordedBy));
        snapshot.put("source", format(source));
        snapshot.put("device_id", format(deviceId));
        snapshot.put("type", format(type));
        for (MeasurementField field : MeasurementField.values()) {
            snapshot.put(field.column(), field.valueOf(this));
        }
        snapshot.put("taken_at", format(takenAt));
        snapshot.put("created_at", format(getCreatedAt()));
        snapshot.put("updated_at", format(getUpdatedAt()));
        snapshot.put("deleted_at", format(getDeletedAt()));
        return snapshot;
    }
}
