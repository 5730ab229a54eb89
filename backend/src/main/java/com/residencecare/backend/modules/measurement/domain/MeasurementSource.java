package com.residencecare.backend.modules.measurement.domain;

public enum MeasurementSource {
    DEVICE,
    VOICE,
    MANUAL
}
