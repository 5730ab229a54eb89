package com.residencecare.backend.modules.lifecycle.application;

import java.util.Objects;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;

public final class ResidenceScope {

    private ResidenceScope() {
    }

    /**
     * Rejects a reference to a row owned by another residence.
     */
    public static void requireSameResidence(UUID ownerResidenceId, String reference, UUID referenceId,
                                            UUID referenceResidenceId) {
        if (!Objects.equals(ownerResidenceId, referenceResidenceId)) {
            throw EntityLifecycleException.crossTenant(reference, referenceId, ownerResidenceId, referenceResidenceId);
        }
    }
}
