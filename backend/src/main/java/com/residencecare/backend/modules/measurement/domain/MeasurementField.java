package com.residencecare.backend.modules.measurement.domain;

import java.util.function.Function;

/**
 * The value columns of a measurement, in column order.
 */
public enum MeasurementField {
    SYSTOLIC("systolic", Measurement::getSystolic),
    DIASTOLIC("diastolic", Measurement::getDiastolic),
    PULSE_BPM("pulse_bpm", Measurement::getPulseBpm),
    SPO2("spo2", Measurement::getSpo2),
    WEIGHT_KG("weight_kg", Measurement::getWeightKg),
    TEMPERATURE_C("temperature_c", Measurement::getTemperatureC);

    private final String column;
    private final Function<Measurement, Object> accessor;

    MeasurementField(String column, Function<Measurement, Object> accessor) {
        this.column = column;
        this.accessor = accessor;
    }

    public String column() {
        return column;
    }

    public Object valueOf(Measurement measurement) {
        return accessor.apply(measurement);
    }
}
