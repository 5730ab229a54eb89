package com.residencecare.backend.modules.resident.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.residencecare.backend.modules.resident.domain.Resident;

public interface ResidentRepository extends LifecycleRepository<Resident> {

    List<Resident> findByResidenceIdAndDeletedAtIsNullOrderByFullNameAsc(UUID residenceId);
}
