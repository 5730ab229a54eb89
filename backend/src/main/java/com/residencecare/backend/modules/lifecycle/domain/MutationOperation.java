package com.residencecare.backend.modules.lifecycle.domain;

public enum MutationOperation {
    INSERT,
    UPDATE,
    DELETE
}
