package com.residencecare.backend.modules.lifecycle.domain;

import java.util.UUID;

import com.residencecare.backend.global.error.ProblemException;

/**
 * A mutation rejected by a guard or by a store constraint. The whole transaction
 * of the attempt has been rolled back when the caller sees it.
 */
public class EntityLifecycleException extends ProblemException {

    private final EntityLifecycleFailure failure;

    public EntityLifecycleException(EntityLifecycleFailure failure, String detail) {
        this(failure, detail, null);
    }

    public EntityLifecycleException(EntityLifecycleFailure failure, String detail, Throwable cause) {
        super(failure.getStatus(), failure.getCode(), detail, cause);
        this.failure = failure;
    }

    public static EntityLifecycleException referenceNotFound(String reference, UUID id) {
        return new EntityLifecycleException(EntityLifecycleFailure.REFERENCE_NOT_FOUND,
                reference + " " + id + " does not exist");
    }

    public static EntityLifecycleException crossTenant(String reference, UUID referenceId, UUID expectedResidenceId,
                                                       UUID actualResidenceId) {
        return new EntityLifecycleException(EntityLifecycleFailure.CROSS_TENANT_VIOLATION,
                reference + " " + referenceId + " belongs to residence " + actualResidenceId
                        + ", expected residence " + expectedResidenceId);
    }

    public static EntityLifecycleException malformedMeasurement(String type, String field, boolean missing) {
        String problem = missing ? "requires field " : "must not set field ";
        return new EntityLifecycleException(EntityLifecycleFailure.MALFORMED_MEASUREMENT,
                "measurement type " + type + " " + problem + field);
    }

    public static EntityLifecycleException invalidIndex(int index, int min, int max) {
        return new EntityLifecycleException(EntityLifecycleFailure.INVALID_INDEX,
                "selected_status_index " + index + " is outside [" + min + "," + max + "]");
    }

    public static EntityLifecycleException invalidValue(String detail) {
        return new EntityLifecycleException(EntityLifecycleFailure.INVALID_VALUE, detail);
    }

    public EntityLifecycleFailure getFailure() {
        return failure;
    }
}
