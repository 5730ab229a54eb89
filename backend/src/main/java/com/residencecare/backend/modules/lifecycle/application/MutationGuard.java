package com.residencecare.backend.modules.lifecycle.application;

import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;

/**
 * Pre-commit check bound to one entity type. A guard may rewrite fields of the pending
 * entity or abort by throwing; it runs inside the transaction of the write it checks.
 */
@FunctionalInterface
public interface MutationGuard<T extends LifecycleEntity> {

    void check(Mutation<? extends T> mutation);
}
