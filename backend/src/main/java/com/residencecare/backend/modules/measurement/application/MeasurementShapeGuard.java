package com.residencecare.backend.modules.measurement.application;

import com.residencecare.backend.modules.lifecycle.application.Mutation;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.measurement.domain.Measurement;
import com.residencecare.backend.modules.measurement.domain.MeasurementField;
import com.residencecare.backend.modules.measurement.domain.MeasurementType;

import org.springframework.stereotype.Component;

/**
 * Rejects a measurement whose value columns do not match its type's field group.
 * The first offending column in column order is reported.
 */
@Component
public class MeasurementShapeGuard implements MutationGuard<Measurement> {

    @Override
    public void check(Mutation<? extends Measurement> mutation) {
        Measurement measurement = mutation.entity();
        MeasurementType type = measurement.getType();
        if (type == null) {
            throw EntityLifecycleException.invalidValue("measurement type is required");
        }
        for (MeasurementField field : MeasurementField.values()) {
            boolean present = field.valueOf(measurement) != null;
            if (!present && type.requires(field)) {
                throw EntityLifecycleException.malformedMeasurement(type.label(), field.column(), true);
            }
            if (present && !type.permits(field)) {
                throw EntityLifecycleException.malformedMeasurement(type.label(), field.column(), false);
            }
        }
    }
}
