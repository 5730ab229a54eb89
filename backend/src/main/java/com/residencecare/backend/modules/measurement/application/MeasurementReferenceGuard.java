package com.residencecare.backend.modules.measurement.application;

import java.util.UUID;

import com.residencecare.backend.modules.device.domain.Device;
import com.residencecare.backend.modules.device.infrastructure.persistence.DeviceRepository;
import com.residencecare.backend.modules.lifecycle.application.Mutation;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.application.ResidenceScope;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.measurement.domain.Measurement;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.resident.infrastructure.persistence.ResidentRepository;

import org.springframework.stereotype.Component;

@Component
public class MeasurementReferenceGuard implements MutationGuard<Measurement> {

    private final ResidentRepository residentRepository;
    private final DeviceRepository deviceRepository;

    public MeasurementReferenceGuard(ResidentRepository residentRepository, DeviceRepository deviceRepository) {
        this.residentRepository = residentRepository;
        this.deviceRepository = deviceRepository;
    }

    @Override
    public void check(Mutation<? extends Measurement> mutation) {
        Measurement measurement = mutation.entity();

        UUID residentId = measurement.getResidentId();
        Resident resident = residentRepository.findById(residentId)
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound("resident", residentId));
        ResidenceScope.requireSameResidence(measurement.getResidenceId(), "resident", residentId,
                resident.getResidenceId());

        UUID deviceId = measurement.getDeviceId();
        if (deviceId != null) {
            Device device = deviceRepository.findById(deviceId)
                    .orElseThrow(() -> EntityLifecycleException.referenceNotFound("device", deviceId));
            ResidenceScope.requireSameResidence(measurement.getResidenceId(), "device", deviceId,
                    device.getResidenceId());
        }
    }
}
