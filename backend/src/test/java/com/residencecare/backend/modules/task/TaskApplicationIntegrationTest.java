package com.residencecare.backend.modules.task;

import static com.residencecare.backend.support.StructureFixtures.ACTOR_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.history.application.HistoryRecorder;
import com.residencecare.backend.modules.history.application.HistoryRecorder.HistoryEntry;
import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleFailure;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.task.application.TaskService;
import com.residencecare.backend.modules.task.application.TaskService.TaskApplicationCommand;
import com.residencecare.backend.modules.task.application.TaskService.TaskTemplateCommand;
import com.residencecare.backend.modules.task.domain.TaskApplication;
import com.residencecare.backend.modules.task.domain.TaskTemplate;
import com.residencecare.backend.support.AbstractPostgresIntegrationTest;
import com.residencecare.backend.support.StructureFixtures;
import com.residencecare.backend.support.StructureFixtures.Site;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class TaskApplicationIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final OffsetDateTime APPLIED_AT = OffsetDateTime.parse("2025-03-01T09:00:00Z");
    private static final List<String> LABELS = List.of("Pending", "Started", "Completed", "Refused", "Skipped", "Other");

    @Autowired
    private TaskService taskService;

    @Autowired
    private HistoryRecorder historyRecorder;

    @Autowired
    private StructureFixtures fixtures;

    private Site site;
    private Resident resident;
    private TaskTemplate template;

    @BeforeEach
    void setUp() {
        site = fixtures.site("Residence North");
        resident = fixtures.resident(site, "Ana Ruiz", null);
        template = taskService.createTemplate(site.residenceId(), new TaskTemplateCommand("Shower", LABELS), ACTOR_ID);
    }

    @Test
    @DisplayName("selected index copies the template label, later template edits are not retroactive")
    void labelCopiedAtWriteTime() {
        TaskApplication application = taskService.apply(site.residenceId(), command(3), ACTOR_ID);
        assertThat(application.getSelectedStatusText()).isEqualTo("Completed");

        List<String> renamed = List.of("Pending", "Started", "Done", "Refused", "Skipped", "Other");
        taskService.updateTemplate(template.getId(), new TaskTemplateCommand("Shower", renamed), ACTOR_ID);

        assertThat(taskService.findApplication(application.getId()).getSelectedStatusText()).isEqualTo("Completed");

        TaskApplication resaved = taskService.selectStatus(application.getId(), 3, ACTOR_ID);
        assertThat(resaved.getSelectedStatusText()).isEqualTo("Done");
    }

    @Test
    @DisplayName("re-saving with the same index and template yields the same text")
    void resaveIsIdempotent() {
        TaskApplication application = taskService.apply(site.residenceId(), command(2), ACTOR_ID);

        TaskApplication first = taskService.selectStatus(application.getId(), 2, ACTOR_ID);
        TaskApplication second = taskService.selectStatus(application.getId(), 2, ACTOR_ID);

        assertThat(first.getSelectedStatusText()).isEqualTo("Started");
        assertThat(second.getSelectedStatusText()).isEqualTo("Started");
        List<HistoryEntry> history = historyRecorder.historyOf(TrackedEntityType.TASK_APPLICATION, application.getId());
        assertThat(history).hasSize(3);
        assertThat(history.get(2).snapshot().get("selected_status_text"))
                .isEqualTo(history.get(2).previousSnapshot().get("selected_status_text"));
    }

    @Test
    @DisplayName("null index clears the text and an empty slot stores a null text")
    void nullIndexAndEmptySlot() {
        TaskTemplate sparse = taskService.createTemplate(site.residenceId(),
                new TaskTemplateCommand("Walk", Arrays.asList("Pending", null)), ACTOR_ID);

        TaskApplication application = taskService.apply(site.residenceId(), command(null), ACTOR_ID);
        assertThat(application.getSelectedStatusText()).isNull();

        TaskApplication emptySlot = taskService.apply(site.residenceId(),
                new TaskApplicationCommand(resident.getId(), sparse.getId(), APPLIED_AT, 2), ACTOR_ID);
        assertThat(emptySlot.getSelectedStatusText()).isNull();
        assertThat(emptySlot.getSelectedStatusIndex()).isEqualTo(2);
    }

    @Test
    @DisplayName("an index outside 1..6 is rejected")
    void outOfRangeIndexRejected() {
        assertThatThrownBy(() -> taskService.apply(site.residenceId(), command(7), ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.INVALID_INDEX));
        assertThatThrownBy(() -> taskService.apply(site.residenceId(), command(0), ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.INVALID_INDEX));
    }

    @Test
    @DisplayName("an unknown template surfaces as a missing reference")
    void unknownTemplateRejected() {
        TaskApplicationCommand unknown = new TaskApplicationCommand(resident.getId(), UUID.randomUUID(), APPLIED_AT, 1);

        assertThatThrownBy(() -> taskService.apply(site.residenceId(), unknown, ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.REFERENCE_NOT_FOUND));
    }

    @Test
    @DisplayName("a template of another residence is a cross-tenant violation")
    void foreignTemplateRejected() {
        Site otherSite = fixtures.site("Residence South");
        TaskTemplate foreign = taskService.createTemplate(otherSite.residenceId(),
                new TaskTemplateCommand("Meal", LABELS), ACTOR_ID);

        TaskApplicationCommand command = new TaskApplicationCommand(resident.getId(), foreign.getId(), APPLIED_AT, 1);
        assertThatThrownBy(() -> taskService.apply(site.residenceId(), command, ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.CROSS_TENANT_VIOLATION));
    }

    private TaskApplicationCommand command(Integer index) {
        return new TaskApplicationCommand(resident.getId(), template.getId(), APPLIED_AT, index);
    }
}
