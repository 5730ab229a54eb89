package com.residencecare.backend.modules.task.infrastructure.persistence;

import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.residencecare.backend.modules.task.domain.TaskApplication;

public interface TaskApplicationRepository extends LifecycleRepository<TaskApplication> {
}
