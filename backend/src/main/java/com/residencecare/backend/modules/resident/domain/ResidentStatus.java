package com.residencecare.backend.modules.resident.domain;

public enum ResidentStatus {
    ACTIVE,
    DISCHARGED,
    DECEASED;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
