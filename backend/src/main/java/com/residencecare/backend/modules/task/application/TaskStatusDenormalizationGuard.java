package com.residencecare.backend.modules.task.application;

import com.residencecare.backend.modules.lifecycle.application.Mutation;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.task.domain.TaskApplication;
import com.residencecare.backend.modules.task.domain.TaskStatusSlot;
import com.residencecare.backend.modules.task.infrastructure.persistence.TaskTemplateRepository;

import org.springframework.stereotype.Component;

/**
 * Copies the label of the selected slot from the template into the application. A missing
 * template or an empty slot yields a null text rather than a rejection.
 */
@Component
public class TaskStatusDenormalizationGuard implements MutationGuard<TaskApplication> {

    private final TaskTemplateRepository taskTemplateRepository;

    public TaskStatusDenormalizationGuard(TaskTemplateRepository taskTemplateRepository) {
        this.taskTemplateRepository = taskTemplateRepository;
    }

    @Override
    public void check(Mutation<? extends TaskApplication> mutation) {
        TaskApplication application = mutation.entity();
        Integer index = application.getSelectedStatusIndex();
        if (index == null) {
            application.setSelectedStatusText(null);
            return;
        }
        TaskStatusSlot slot = TaskStatusSlot.fromIndex(index)
                .orElseThrow(() -> EntityLifecycleException.invalidIndex(index,
                        TaskStatusSlot.MIN_INDEX, TaskStatusSlot.MAX_INDEX));
        String label = application.getTaskTemplateId() == null ? null
                : taskTemplateRepository.findById(application.getTaskTemplateId())
                        .map(template -> template.getStatusLabel(slot))
                        .orElse(null);
        application.setSelectedStatusText(label);
    }
}
