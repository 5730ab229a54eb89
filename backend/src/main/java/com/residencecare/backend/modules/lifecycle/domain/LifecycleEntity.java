package com.residencecare.backend.modules.lifecycle.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A current-state row that is only written through the lifecycle engine.
 */
public interface LifecycleEntity {

    UUID getId();

    /**
     * Residence the row belongs to, or {@code null} for rows without a tenancy scope (tags).
     */
    UUID getResidenceId();

    void stampCreated(OffsetDateTime now);

    void stampModified(OffsetDateTime now);

    void softDelete(OffsetDateTime now);

    boolean isDeleted();

    /**
     * Full state of the row as JSON-compatible values, keyed by column name.
     */
    Map<String, Object> toSnapshot();
}
