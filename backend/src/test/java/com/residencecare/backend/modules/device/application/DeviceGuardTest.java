package com.residencecare.backend.modules.device.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.residencecare.backend.modules.device.domain.Device;
import com.residencecare.backend.modules.device.domain.DeviceType;
import com.residencecare.backend.modules.lifecycle.application.Mutation;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleFailure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DeviceGuardTest {

    private final DeviceGuard guard = new DeviceGuard();

    @Test
    @DisplayName("mac addresses are trimmed and upper-cased")
    void normalizesMac() {
        Device device = device(" aa:bb:cc:dd:ee:0f ", 40);

        check(device);

        assertThat(device.getMac()).isEqualTo("AA:BB:CC:DD:EE:0F");
    }

    @Test
    @DisplayName("battery bounds are inclusive")
    void batteryBounds() {
        Device empty = device("AA:00:00:00:00:01", 0);
        Device full = device("AA:00:00:00:00:02", 100);
        Device unknown = device("AA:00:00:00:00:03", null);

        check(empty);
        check(full);
        check(unknown);

        assertThat(unknown.getBatteryPercent()).isNull();
    }

    @Test
    @DisplayName("battery above one hundred is rejected")
    void batteryAboveRange() {
        Device device = device("AA:00:00:00:00:04", 101);

        assertThatThrownBy(() -> check(device))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.INVALID_VALUE))
                .hasMessageContaining("battery_percent 101");
    }

    private void check(Device device) {
        guard.check(Mutation.insert(device, UUID.randomUUID(), OffsetDateTime.parse("2025-03-01T08:00:00Z")));
    }

    private static Device device(String mac, Integer battery) {
        Device device = new Device();
        device.setResidenceId(UUID.randomUUID());
        device.setType(DeviceType.PULSE_OXIMETER);
        device.setName("Oximeter");
        device.setMac(mac);
        device.setBatteryPercent(battery);
        return device;
    }
}
