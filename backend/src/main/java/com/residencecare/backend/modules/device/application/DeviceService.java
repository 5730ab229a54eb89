package com.residencecare.backend.modules.device.application;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.device.domain.Device;
import com.residencecare.backend.modules.device.domain.DeviceType;
import com.residencecare.backend.modules.device.infrastructure.persistence.DeviceRepository;
import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.lifecycle.application.EntityLifecycleEngine;
import com.residencecare.backend.modules.lifecycle.application.LifecycleDescriptor;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class DeviceService {

    private final EntityLifecycleEngine engine;
    private final DeviceRepository deviceRepository;
    private final LifecycleDescriptor<Device> devices;

    public DeviceService(EntityLifecycleEngine engine, DeviceRepository deviceRepository, DeviceGuard deviceGuard) {
        this.engine = engine;
        this.deviceRepository = deviceRepository;
        List<MutationGuard<? super Device>> guards = List.of(deviceGuard);
        this.devices = LifecycleDescriptor.tracked(TrackedEntityType.DEVICE, deviceRepository, guards);
    }

    public Device register(@NotNull UUID residenceId, @Valid DeviceCommand command, @NotNull UUID actorId) {
        Device device = new Device();
        device.setResidenceId(residenceId);
        command.applyTo(device);
        return engine.insert(devices, device, actorId);
    }

    public Device update(@NotNull UUID deviceId, @Valid DeviceCommand command, @NotNull UUID actorId) {
        return engine.update(devices, deviceId, command::applyTo, actorId);
    }

    public Device reportBattery(@NotNull UUID deviceId, Integer batteryPercent, @NotNull UUID actorId) {
        return engine.update(devices, deviceId, device -> device.setBatteryPercent(batteryPercent), actorId);
    }

    public Device softDelete(@NotNull UUID deviceId, @NotNull UUID actorId) {
        return engine.softDelete(devices, deviceId, actorId);
    }

    /**
     * Physically removes a device that no measurement references. The last snapshot stays
     * in the device history as a {@code delete} row.
     */
    public void purge(@NotNull UUID deviceId, @NotNull UUID actorId) {
        engine.delete(devices, deviceId, actorId);
    }

    @Transactional(readOnly = true)
    public Device findById(UUID deviceId) {
        return deviceRepository.findById(deviceId)
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound("device", deviceId));
    }

    @Transactional(readOnly = true)
    public List<Device> devicesOf(UUID residenceId) {
        return deviceRepository.findByResidenceIdAndDeletedAtIsNullOrderByNameAsc(residenceId);
    }

    public record DeviceCommand(
            @NotNull DeviceType type,
            @NotBlank @Size(max = 200) String name,
            @NotBlank @Size(max = 32) String mac,
            Integer batteryPercent
    ) {

        void applyTo(Device device) {
            device.setType(type);
            device.setName(name.trim());
            device.setMac(mac);
            device.setBatteryPercent(batteryPercent);
        }
    }
}
