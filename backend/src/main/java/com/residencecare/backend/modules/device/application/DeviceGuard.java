package com.residencecare.backend.modules.device.application;

import java.util.Locale;

import com.residencecare.backend.modules.device.domain.Device;
import com.residencecare.backend.modules.lifecycle.application.Mutation;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;

import org.springframework.stereotype.Component;

@Component
public class DeviceGuard implements MutationGuard<Device> {

    static final int MIN_BATTERY = 0;
    static final int MAX_BATTERY = 100;

    @Override
    public void check(Mutation<? extends Device> mutation) {
        Device device = mutation.entity();
        if (device.getMac() != null) {
            // uniqueness is case-insensitive through normalization
            device.setMac(device.getMac().trim().toUpperCase(Locale.ROOT));
        }
        Integer battery = device.getBatteryPercent();
        if (battery != null && (battery < MIN_BATTERY || battery > MAX_BATTERY)) {
            throw EntityLifecycleException.invalidValue(
                    "battery_percent " + battery + " is outside [" + MIN_BATTERY + "," + MAX_BATTERY + "]");
        }
    }
}
