package com.residencecare.backend.modules.device.domain;

public enum DeviceType {
    BLOOD_PRESSURE,
    PULSE_OXIMETER,
    SCALE,
    THERMOMETER
}
