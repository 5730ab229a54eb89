package com.residencecare.backend.modules.lifecycle.application;

import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;

import org.springframework.stereotype.Component;

/**
 * Stamps created/updated timestamps with the mutation time. Runs last for every entity
 * type so that nothing the caller or an earlier guard set survives.
 */
@Component
public class TimestampGuard implements MutationGuard<LifecycleEntity> {

    @Override
    public void check(Mutation<? extends LifecycleEntity> mutation) {
        if (mutation.isInsert()) {
            mutation.entity().stampCreated(mutation.occurredAt());
        } else if (mutation.isUpdate()) {
            mutation.entity().stampModified(mutation.occurredAt());
        }
    }
}
