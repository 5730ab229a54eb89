package com.residencecare.backend.modules.resident;

import static com.residencecare.backend.support.StructureFixtures.ACTOR_ID;
import static com.residencecare.backend.support.StructureFixtures.residentCommand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.residencecare.backend.modules.eventlog.application.EventLogService;
import com.residencecare.backend.modules.eventlog.domain.EventLog;
import com.residencecare.backend.modules.history.application.HistoryRecorder;
import com.residencecare.backend.modules.history.application.HistoryRecorder.HistoryEntry;
import com.residencecare.backend.modules.history.domain.ChangeKind;
import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleFailure;
import com.residencecare.backend.modules.residence.application.StructureService;
import com.residencecare.backend.modules.residence.domain.Bed;
import com.residencecare.backend.modules.resident.application.ResidentService;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.resident.domain.ResidentStatus;
import com.residencecare.backend.support.AbstractPostgresIntegrationTest;
import com.residencecare.backend.support.StructureFixtures;
import com.residencecare.backend.support.StructureFixtures.Site;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ResidentLifecycleIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private ResidentService residentService;

    @Autowired
    private StructureService structureService;

    @Autowired
    private HistoryRecorder historyRecorder;

    @Autowired
    private EventLogService eventLogService;

    @Autowired
    private StructureFixtures fixtures;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Site site;
    private Bed bed1;
    private Bed bed2;

    @BeforeEach
    void setUp() {
        site = fixtures.site("Residence North");
        bed1 = fixtures.bed(site, "B1");
        bed2 = fixtures.bed(site, "B2");
    }

    @Test
    @DisplayName("second active resident on an occupied bed fails with an occupancy conflict and leaves no trail")
    void occupiedBedRejectsSecondActiveResident() {
        Resident first = fixtures.resident(site, "Ana Ruiz", bed1.getId());

        assertThatThrownBy(() -> fixtures.resident(site, "Carla Diaz", bed1.getId()))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.OCCUPANCY_CONFLICT));

        assertThat(countRows("resident")).isEqualTo(1);
        assertThat(countRows("resident_history")).isEqualTo(1);
        assertThat(countRows("event_log")).isEqualTo(1);
        assertThat(residentService.findById(first.getId()).getBedId()).isEqualTo(bed1.getId());
    }

    @Test
    @DisplayName("discharge releases the bed, stamps status and soft-delete timestamps and logs assign_bed")
    void dischargeReleasesBed() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());

        Resident discharged = residentService.changeStatus(resident.getId(), ResidentStatus.DISCHARGED, ACTOR_ID);

        assertThat(discharged.getBedId()).isNull();
        assertThat(discharged.getStatusChangedAt()).isNotNull();
        assertThat(discharged.getDeletedAt()).isEqualTo(discharged.getStatusChangedAt());
        assertThat(discharged.getUpdatedAt()).isEqualTo(discharged.getStatusChangedAt());

        List<EventLog> events = eventLogService.eventsForEntity("resident", resident.getId());
        assertThat(events).extracting(EventLog::getAction).containsExactly("create", "update", "assign_bed");
        EventLog assignBed = events.get(2);
        assertThat(assignBed.getPayload().get("old_bed_id")).isEqualTo(bed1.getId().toString());
        assertThat(assignBed.getPayload().get("new_bed_id")).isNull();
        assertThat(assignBed.getOccurredAt()).isAtSameInstantAs(events.get(1).getOccurredAt());

        List<HistoryEntry> history = historyRecorder.historyOf(TrackedEntityType.RESIDENT, resident.getId());
        assertThat(history).extracting(HistoryEntry::changeKind)
                .containsExactly(ChangeKind.CREATE, ChangeKind.UPDATE);
        assertThat(history.get(1).previousSnapshot().get("bed_id")).isEqualTo(bed1.getId().toString());
        assertThat(history.get(1).snapshot().get("bed_id")).isNull();
        assertThat(history.get(1).snapshot().get("status")).isEqualTo("DISCHARGED");

        Resident next = fixtures.resident(site, "Carla Diaz", bed1.getId());
        assertThat(next.getBedId()).isEqualTo(bed1.getId());
    }

    @Test
    @DisplayName("non-active status forces a null bed even when one is supplied")
    void inactiveStatusForcesNullBed() {
        Resident resident = residentService.admit(site.residenceId(),
                residentCommand("Eva Gil", ResidentStatus.DECEASED, bed1.getId()), ACTOR_ID);

        assertThat(resident.getBedId()).isNull();
        assertThat(resident.getStatusChangedAt()).isNotNull();
        assertThat(resident.getDeletedAt()).isNotNull();
    }

    @Test
    @DisplayName("bed to bed transfer logs exactly one assign_bed event")
    void transferLogsSingleAssignBed() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());

        residentService.assignBed(resident.getId(), bed2.getId(), ACTOR_ID);

        List<EventLog> assignBeds = eventLogService.eventsForEntity("resident", resident.getId()).stream()
                .filter(event -> event.getAction().equals("assign_bed"))
                .toList();
        assertThat(assignBeds).hasSize(1);
        assertThat(assignBeds.get(0).getPayload())
                .containsEntry("old_bed_id", bed1.getId().toString())
                .containsEntry("new_bed_id", bed2.getId().toString());

        Resident other = fixtures.resident(site, "Carla Diaz", bed1.getId());
        assertThat(other.getBedId()).isEqualTo(bed1.getId());
    }

    @Test
    @DisplayName("an update that keeps the bed emits no assign_bed event")
    void unchangedBedEmitsNoAssignBed() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());

        residentService.update(resident.getId(),
                residentCommand("Ana Ruiz Lopez", ResidentStatus.ACTIVE, bed1.getId()), ACTOR_ID);

        assertThat(eventLogService.eventsForEntity("resident", resident.getId()))
                .extracting(EventLog::getAction)
                .containsExactly("create", "update");
    }

    @Test
    @DisplayName("moving to a bed of another residence is a cross-tenant violation with no trail")
    void crossTenantBedRejected() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());
        Site otherSite = fixtures.site("Residence South");
        Bed foreignBed = fixtures.bed(otherSite, "B1");
        long historyBefore = countRows("resident_history");
        long eventsBefore = countRows("event_log");

        assertThatThrownBy(() -> residentService.assignBed(resident.getId(), foreignBed.getId(), ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.CROSS_TENANT_VIOLATION));

        assertThat(countRows("resident_history")).isEqualTo(historyBefore);
        assertThat(countRows("event_log")).isEqualTo(eventsBefore);
        assertThat(residentService.findById(resident.getId()).getBedId()).isEqualTo(bed1.getId());
    }

    @Test
    @DisplayName("unknown and soft-deleted beds are reported as missing references")
    void missingBedRejected() {
        UUID unknownBed = UUID.randomUUID();
        assertThatThrownBy(() -> fixtures.resident(site, "Ana Ruiz", unknownBed))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.REFERENCE_NOT_FOUND));

        structureService.softDeleteBed(bed2.getId(), ACTOR_ID);
        assertThatThrownBy(() -> fixtures.resident(site, "Ana Ruiz", bed2.getId()))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.REFERENCE_NOT_FOUND));
        assertThat(countRows("resident")).isZero();
    }

    @Test
    @DisplayName("every history row has an event row with the same entity, timestamp and snapshot")
    void historyAndEventsArePaired() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", null);
        residentService.assignBed(resident.getId(), bed1.getId(), ACTOR_ID);
        residentService.softDelete(resident.getId(), ACTOR_ID);

        List<HistoryEntry> history = historyRecorder.historyOf(TrackedEntityType.RESIDENT, resident.getId());
        List<EventLog> trailEvents = eventLogService.eventsForEntity("resident", resident.getId()).stream()
                .filter(event -> !event.getAction().equals("assign_bed"))
                .toList();

        assertThat(history).hasSize(3);
        assertThat(trailEvents).hasSize(3);
        for (int i = 0; i < history.size(); i++) {
            HistoryEntry entry = history.get(i);
            EventLog event = trailEvents.get(i);
            assertThat(event.getEntityId()).isEqualTo(entry.entityId());
            assertThat(event.getAction()).isEqualTo(entry.changeKind().label());
            assertThat(event.getOccurredAt()).isAtSameInstantAs(entry.recordedAt());
            assertThat(event.getActorId()).isEqualTo(ACTOR_ID);
            assertThat(event.getResidenceId()).isEqualTo(site.residenceId());
            assertThat(event.getPayload().get("snapshot")).isEqualTo(entry.snapshot());
        }
        assertThat(history).extracting(HistoryEntry::sequence).isSorted();
        assertThat(history.get(2).changeKind()).isEqualTo(ChangeKind.UPDATE);
        assertThat(history.get(2).snapshot().get("deleted_at")).isNotNull();
        assertThat(history.get(2).previousSnapshot().get("deleted_at")).isNull();
    }

    @Test
    @DisplayName("leaving active again after a readmission restamps status_changed_at")
    void redischargeRestampsStatusChange() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());
        Resident discharged = residentService.changeStatus(resident.getId(), ResidentStatus.DISCHARGED, ACTOR_ID);
        residentService.changeStatus(resident.getId(), ResidentStatus.ACTIVE, ACTOR_ID);

        Resident again = residentService.changeStatus(resident.getId(), ResidentStatus.DECEASED, ACTOR_ID);

        assertThat(again.getStatusChangedAt()).isAfter(discharged.getStatusChangedAt());
        assertThat(again.getDeletedAt()).isEqualTo(again.getStatusChangedAt());
    }

    @Test
    @DisplayName("readmission clears the soft-delete marker so the bed is guarded by the occupancy index again")
    void readmissionRestoresResident() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());
        residentService.changeStatus(resident.getId(), ResidentStatus.DISCHARGED, ACTOR_ID);
        residentService.changeStatus(resident.getId(), ResidentStatus.ACTIVE, ACTOR_ID);

        Resident readmitted = residentService.assignBed(resident.getId(), bed2.getId(), ACTOR_ID);

        assertThat(readmitted.getDeletedAt()).isNull();
        assertThat(readmitted.getBedId()).isEqualTo(bed2.getId());
        assertThat(residentService.activeResidents(site.residenceId()))
                .extracting(Resident::getId)
                .containsExactly(resident.getId());
        assertThatThrownBy(() -> fixtures.resident(site, "Carla Diaz", bed2.getId()))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.OCCUPANCY_CONFLICT));
    }

    @Test
    @DisplayName("soft-deleting an active resident releases the bed and a deleted resident cannot take one")
    void softDeletedResidentHoldsNoBed() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());

        Resident deleted = residentService.softDelete(resident.getId(), ACTOR_ID);

        assertThat(deleted.getBedId()).isNull();
        assertThat(deleted.getStatus()).isEqualTo(ResidentStatus.ACTIVE);
        assertThat(residentService.activeResidents(site.residenceId())).isEmpty();
        assertThatThrownBy(() -> residentService.assignBed(resident.getId(), bed2.getId(), ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.INVALID_VALUE));
        assertThat(fixtures.resident(site, "Carla Diaz", bed1.getId()).getBedId()).isEqualTo(bed1.getId());
    }

    @Test
    @DisplayName("the update timestamp is always set by the engine")
    void updateTimestampIsStamped() {
        Resident resident = fixtures.resident(site, "Ana Ruiz", null);

        Resident updated = residentService.update(resident.getId(),
                residentCommand("Ana Ruiz", ResidentStatus.ACTIVE, null), ACTOR_ID);

        assertThat(updated.getCreatedAt()).isEqualTo(resident.getCreatedAt());
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(resident.getUpdatedAt());
    }

    @Test
    @DisplayName("concurrent admissions to the same bed: exactly one wins")
    void concurrentAdmissionsToSameBed() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Resident>> futures = new ArrayList<>();
            for (String name : List.of("Ana Ruiz", "Carla Diaz")) {
                Callable<Resident> admission = () -> {
                    start.await();
                    return fixtures.resident(site, name, bed1.getId());
                };
                futures.add(executor.submit(admission));
            }
            start.countDown();

            int successes = 0;
            int conflicts = 0;
            for (Future<Resident> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOfSatisfying(EntityLifecycleException.class, cause ->
                            assertThat(cause.getFailure()).isEqualTo(EntityLifecycleFailure.OCCUPANCY_CONFLICT));
                    conflicts++;
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(conflicts).isEqualTo(1);
            assertThat(countRows("resident_history")).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("concurrent bed moves of one resident are serialized and keep the history chain intact")
    void concurrentMovesKeepHistoryChain() throws Exception {
        Bed bed3 = fixtures.bed(site, "B3");
        Resident resident = fixtures.resident(site, "Ana Ruiz", bed1.getId());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Resident>> futures = new ArrayList<>();
            for (Bed target : List.of(bed2, bed3)) {
                Callable<Resident> move = () -> {
                    start.await();
                    return residentService.assignBed(resident.getId(), target.getId(), ACTOR_ID);
                };
                futures.add(executor.submit(move));
            }
            start.countDown();
            for (Future<Resident> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<HistoryEntry> history = historyRecorder.historyOf(TrackedEntityType.RESIDENT, resident.getId());
        assertThat(history).extracting(HistoryEntry::changeKind)
                .containsExactly(ChangeKind.CREATE, ChangeKind.UPDATE, ChangeKind.UPDATE);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).previousSnapshot()).isEqualTo(history.get(i - 1).snapshot());
        }

        List<EventLog> moves = eventLogService.eventsForEntity("resident", resident.getId()).stream()
                .filter(event -> event.getAction().equals("assign_bed"))
                .toList();
        assertThat(moves).hasSize(2);
        assertThat(moves.get(0).getPayload().get("old_bed_id")).isEqualTo(bed1.getId().toString());
        assertThat(moves.get(1).getPayload().get("old_bed_id"))
                .isEqualTo(moves.get(0).getPayload().get("new_bed_id"));

        UUID finalBed = residentService.findById(resident.getId()).getBedId();
        assertThat(moves.get(1).getPayload().get("new_bed_id")).isEqualTo(finalBed.toString());
        assertThat(history.get(2).snapshot().get("bed_id")).isEqualTo(finalBed.toString());
    }

    private long countRows(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0L;
    }
}
