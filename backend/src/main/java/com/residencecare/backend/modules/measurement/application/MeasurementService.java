package com.residencecare.backend.modules.measurement.application;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.lifecycle.application.EntityLifecycleEngine;
import com.residencecare.backend.modules.lifecycle.application.LifecycleDescriptor;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.measurement.domain.Measurement;
import com.residencecare.backend.modules.measurement.domain.MeasurementSource;
import com.residencecare.backend.modules.measurement.domain.MeasurementType;
import com.residencecare.backend.modules.measurement.infrastructure.persistence.MeasurementRepository;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class MeasurementService {

    private final EntityLifecycleEngine engine;
    private final MeasurementRepository measurementRepository;
    private final LifecycleDescriptor<Measurement> measurements;

    public MeasurementService(
            EntityLifecycleEngine engine,
            MeasurementRepository measurementRepository,
            MeasurementShapeGuard shapeGuard,
            MeasurementReferenceGuard referenceGuard
    ) {
        this.engine = engine;
        this.measurementRepository = measurementRepository;
        List<MutationGuard<? super Measurement>> guards = List.of(shapeGuard, referenceGuard);
        this.measurements = LifecycleDescriptor.tracked(TrackedEntityType.MEASUREMENT, measurementRepository, guards);
    }

    /**
     * Stores a measurement taken by {@code actorId}, who is also recorded as its author.
     */
    public Measurement record(@NotNull UUID residenceId, @Valid MeasurementCommand command, @NotNull UUID actorId) {
        Measurement measurement = new Measurement();
        measurement.setResidenceId(residenceId);
        measurement.setRecordedBy(actorId);
        command.applyTo(measurement);
        return engine.insert(measurements, measurement, actorId);
    }

    public Measurement update(@NotNull UUID measurementId, @Valid MeasurementCommand command,
                              @NotNull UUID actorId) {
        return engine.update(measurements, measurementId, command::applyTo, actorId);
    }

    public Measurement softDelete(@NotNull UUID measurementId, @NotNull UUID actorId) {
        return engine.softDelete(measurements, measurementId, actorId);
    }

    @Transactional(readOnly = true)
    public Measurement findById(UUID measurementId) {
        return measurementRepository.findById(measurementId)
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound("measurement", measurementId));
    }

    @Transactional(readOnly = true)
    public List<Measurement> measurementsOf(UUID residentId) {
        return measurementRepository.findByResidentIdAndDeletedAtIsNullOrderByTakenAtDesc(residentId);
    }

    public record MeasurementCommand(
            @NotNull UUID residentId,
            @NotNull MeasurementSource source,
            UUID deviceId,
            @NotNull MeasurementType type,
            Integer systolic,
            Integer diastolic,
            Integer pulseBpm,
            Integer spo2,
            Double weightKg,
            Double temperatureC,
            @NotNull OffsetDateTime takenAt
    ) {

        void applyTo(Measurement measurement) {
            measurement.setResidentId(residentId);
            measurement.setSource(source);
            measurement.setDeviceId(deviceId);
            measurement.setType(type);
            measurement.setSystolic(systolic);
            measurement.setDiastolic(diastolic);
            measurement.setPulseBpm(pulseBpm);
            measurement.setSpo2(spo2);
            measurement.setWeightKg(weightKg);
            measurement.setTemperatureC(temperatureC);
            // stored at microsecond precision in UTC
            measurement.setTakenAt(takenAt.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS));
        }
    }
}
