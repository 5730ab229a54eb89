package com.residencecare.backend.modules.lifecycle.domain;

import com.residencecare.backend.global.error.RetryableProblemException;

public class StorageUnavailableException extends RetryableProblemException {

    private static final int RETRY_AFTER_SECONDS = 1;

    public StorageUnavailableException(String detail, Throwable cause) {
        super(EntityLifecycleFailure.STORAGE_UNAVAILABLE.getStatus(),
                EntityLifecycleFailure.STORAGE_UNAVAILABLE.getCode(),
                detail,
                RETRY_AFTER_SECONDS,
                cause);
    }

    public EntityLifecycleFailure getFailure() {
        return EntityLifecycleFailure.STORAGE_UNAVAILABLE;
    }
}
