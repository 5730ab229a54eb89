package com.residencecare.backend.modules.lifecycle.application;

import java.util.List;
import java.util.Objects;

import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;
import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;

/**
 * The guarded-mutation pipeline of one entity type: where its rows live, which guards
 * run before a write, and whether writes are historized.
 *
 * @param trackedType {@code null} for types that are only timestamp-guarded
 */
public record LifecycleDescriptor<T extends LifecycleEntity>(
        String entityName,
        LifecycleRepository<T> repository,
        TrackedEntityType trackedType,
        List<MutationGuard<? super T>> guards
) {

    public LifecycleDescriptor {
        Objects.requireNonNull(entityName, "entityName is required");
        Objects.requireNonNull(repository, "repository is required");
        guards = List.copyOf(guards);
    }

    public static <T extends LifecycleEntity> LifecycleDescriptor<T> tracked(
            TrackedEntityType trackedType,
            LifecycleRepository<T> repository,
            List<MutationGuard<? super T>> guards
    ) {
        return new LifecycleDescriptor<>(trackedType.entityName(), repository, trackedType, guards);
    }

    public static <T extends LifecycleEntity> LifecycleDescriptor<T> untracked(
            String entityName,
            LifecycleRepository<T> repository
    ) {
        return new LifecycleDescriptor<>(entityName, repository, null, List.of());
    }

    public boolean isTracked() {
        return trackedType != null;
    }
}
