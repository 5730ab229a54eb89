package com.residencecare.backend.modules.measurement.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.residencecare.backend.modules.measurement.domain.Measurement;

public interface MeasurementRepository extends LifecycleRepository<Measurement> {

    List<Measurement> findByResidentIdAndDeletedAtIsNullOrderByTakenAtDesc(UUID residentId);
}
