package com.residencecare.backend.modules.residence.infrastructure.persistence;

import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.residencecare.backend.modules.residence.domain.Residence;

public interface ResidenceRepository extends LifecycleRepository<Residence> {
}
