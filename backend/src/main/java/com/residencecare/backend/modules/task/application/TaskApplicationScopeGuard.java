package com.residencecare.backend.modules.task.application;

import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.application.Mutation;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.application.ResidenceScope;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.resident.infrastructure.persistence.ResidentRepository;
import com.residencecare.backend.modules.task.domain.TaskApplication;
import com.residencecare.backend.modules.task.infrastructure.persistence.TaskTemplateRepository;

import org.springframework.stereotype.Component;

@Component
public class TaskApplicationScopeGuard implements MutationGuard<TaskApplication> {

    private final ResidentRepository residentRepository;
    private final TaskTemplateRepository taskTemplateRepository;

    public TaskApplicationScopeGuard(ResidentRepository residentRepository,
                                     TaskTemplateRepository taskTemplateRepository) {
        this.residentRepository = residentRepository;
        this.taskTemplateRepository = taskTemplateRepository;
    }

    @Override
    public void check(Mutation<? extends TaskApplication> mutation) {
        TaskApplication application = mutation.entity();

        UUID residentId = application.getResidentId();
        Resident resident = residentRepository.findById(residentId)
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound("resident", residentId));
        ResidenceScope.requireSameResidence(application.getResidenceId(), "resident", residentId,
                resident.getResidenceId());

        // a missing template surfaces as a foreign key violation on write
        UUID templateId = application.getTaskTemplateId();
        taskTemplateRepository.findById(templateId).ifPresent(template ->
                ResidenceScope.requireSameResidence(application.getResidenceId(), "task_template", templateId,
                        template.getResidenceId()));
    }
}
