package com.residencecare.backend.modules.task.application;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.lifecycle.application.EntityLifecycleEngine;
import com.residencecare.backend.modules.lifecycle.application.LifecycleDescriptor;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.task.domain.TaskApplication;
import com.residencecare.backend.modules.task.domain.TaskStatusSlot;
import com.residencecare.backend.modules.task.domain.TaskTemplate;
import com.residencecare.backend.modules.task.infrastructure.persistence.TaskApplicationRepository;
import com.residencecare.backend.modules.task.infrastructure.persistence.TaskTemplateRepository;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class TaskService {

    private final EntityLifecycleEngine engine;
    private final TaskApplicationRepository taskApplicationRepository;
    private final LifecycleDescriptor<TaskTemplate> templates;
    private final LifecycleDescriptor<TaskApplication> applications;

    public TaskService(
            EntityLifecycleEngine engine,
            TaskTemplateRepository taskTemplateRepository,
            TaskApplicationRepository taskApplicationRepository,
            TaskApplicationScopeGuard scopeGuard,
            TaskStatusDenormalizationGuard denormalizationGuard
    ) {
        this.engine = engine;
        this.taskApplicationRepository = taskApplicationRepository;
        this.templates = LifecycleDescriptor.untracked("task_template", taskTemplateRepository);
        List<MutationGuard<? super TaskApplication>> guards = List.of(scopeGuard, denormalizationGuard);
        this.applications = LifecycleDescriptor.tracked(TrackedEntityType.TASK_APPLICATION,
                taskApplicationRepository, guards);
    }

    public TaskTemplate createTemplate(@NotNull UUID residenceId, @Valid TaskTemplateCommand command,
                                       @NotNull UUID actorId) {
        TaskTemplate template = new TaskTemplate();
        template.setResidenceId(residenceId);
        command.applyTo(template);
        return engine.insert(templates, template, actorId);
    }

    /**
     * Existing applications keep their copied label until they are written again.
     */
    public TaskTemplate updateTemplate(@NotNull UUID templateId, @Valid TaskTemplateCommand command,
                                       @NotNull UUID actorId) {
        return engine.update(templates, templateId, command::applyTo, actorId);
    }

    public TaskTemplate softDeleteTemplate(@NotNull UUID templateId, @NotNull UUID actorId) {
        return engine.softDelete(templates, templateId, actorId);
    }

    public TaskApplication apply(@NotNull UUID residenceId, @Valid TaskApplicationCommand command,
                                 @NotNull UUID actorId) {
        TaskApplication application = new TaskApplication();
        application.setResidenceId(residenceId);
        application.setAppliedBy(actorId);
        command.applyTo(application);
        return engine.insert(applications, application, actorId);
    }

    public TaskApplication updateApplication(@NotNull UUID applicationId, @Valid TaskApplicationCommand command,
                                             @NotNull UUID actorId) {
        return engine.update(applications, applicationId, command::applyTo, actorId);
    }

    public TaskApplication selectStatus(@NotNull UUID applicationId, Integer selectedStatusIndex,
                                        @NotNull UUID actorId) {
        return engine.update(applications, applicationId,
                application -> application.setSelectedStatusIndex(selectedStatusIndex), actorId);
    }

    public TaskApplication softDeleteApplication(@NotNull UUID applicationId, @NotNull UUID actorId) {
        return engine.softDelete(applications, applicationId, actorId);
    }

    @Transactional(readOnly = true)
    public TaskApplication findApplication(UUID applicationId) {
        return taskApplicationRepository.findById(applicationId)
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound("task_application", applicationId));
    }

    public record TaskTemplateCommand(
            @NotBlank @Size(max = 200) String name,
            @NotNull @Size(max = TaskStatusSlot.MAX_INDEX) List<@Size(max = 100) String> statusLabels
    ) {

        void applyTo(TaskTemplate template) {
            template.setName(name.trim());
            for (TaskStatusSlot slot : TaskStatusSlot.values()) {
                int position = slot.index() - 1;
                template.setStatusLabel(slot, position < statusLabels.size() ? statusLabels.get(position) : null);
            }
        }
    }

    public record TaskApplicationCommand(
            @NotNull UUID residentId,
            @NotNull UUID taskTemplateId,
            @NotNull OffsetDateTime appliedAt,
            Integer selectedStatusIndex
    ) {

        void applyTo(TaskApplication application) {
            application.setResidentId(residentId);
            application.setTaskTemplateId(taskTemplateId);
            application.setAppliedAt(appliedAt.withOffsetSameInstant(ZoneOffset.UTC)
                    .truncatedTo(ChronoUnit.MICROS));
            application.setSelectedStatusIndex(selectedStatusIndex);
        }
    }
}
