package com.residencecare.backend.modules.device.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.device.domain.Device;
import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;

public interface DeviceRepository extends LifecycleRepository<Device> {

    List<Device> findByResidenceIdAndDeletedAtIsNullOrderByNameAsc(UUID residenceId);
}
