package com.residencecare.backend.modules.measurement.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Each type owns a field group: required fields must be set, optional fields may be set,
 * every other value column must stay null.
 */
public enum MeasurementType {
    BP(EnumSet.of(MeasurementField.SYSTOLIC, MeasurementField.DIASTOLIC), EnumSet.of(MeasurementField.PULSE_BPM)),
    SPO2(EnumSet.of(MeasurementField.SPO2), EnumSet.of(MeasurementField.PULSE_BPM)),
    WEIGHT(EnumSet.of(MeasurementField.WEIGHT_KG), EnumSet.noneOf(MeasurementField.class)),
    TEMPERATURE(EnumSet.of(MeasurementField.TEMPERATURE_C), EnumSet.noneOf(MeasurementField.class));

    private final Set<MeasurementField> requiredFields;
    private final Set<MeasurementField> optionalFields;

    MeasurementType(Set<MeasurementField> requiredFields, Set<MeasurementField> optionalFields) {
        this.requiredFields = requiredFields;
        this.optionalFields = optionalFields;
    }

    public boolean requires(MeasurementField field) {
        return requiredFields.contains(field);
    }

    public boolean permits(MeasurementField field) {
        return requiredFields.contains(field) || optionalFields.contains(field);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
