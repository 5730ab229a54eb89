package com.residencecare.backend.modules.task.infrastructure.persistence;

import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.residencecare.backend.modules.task.domain.TaskTemplate;

public interface TaskTemplateRepository extends LifecycleRepository<TaskTemplate> {
}
