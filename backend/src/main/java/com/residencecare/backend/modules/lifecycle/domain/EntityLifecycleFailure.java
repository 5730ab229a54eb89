package com.residencecare.backend.modules.lifecycle.domain;

import org.springframework.http.HttpStatus;

/**
 * Kinds of rejected mutations. Only {@link #STORAGE_UNAVAILABLE} is safe to retry.
 */
public enum EntityLifecycleFailure {
    REFERENCE_NOT_FOUND(HttpStatus.NOT_FOUND, "lifecycle.reference_not_found"),
    CROSS_TENANT_VIOLATION(HttpStatus.UNPROCESSABLE_ENTITY, "lifecycle.cross_tenant_violation"),
    OCCUPANCY_CONFLICT(HttpStatus.CONFLICT, "lifecycle.occupancy_conflict"),
    MALFORMED_MEASUREMENT(HttpStatus.UNPROCESSABLE_ENTITY, "lifecycle.malformed_measurement"),
    INVALID_INDEX(HttpStatus.UNPROCESSABLE_ENTITY, "lifecycle.invalid_index"),
    DUPLICATE_VALUE(HttpStatus.CONFLICT, "lifecycle.duplicate_value"),
    INVALID_VALUE(HttpStatus.UNPROCESSABLE_ENTITY, "lifecycle.invalid_value"),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "lifecycle.storage_unavailable");

    private final HttpStatus status;
    private final String code;

    EntityLifecycleFailure(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
