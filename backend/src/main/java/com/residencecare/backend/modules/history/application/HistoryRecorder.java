package com.residencecare.backend.modules.history.application;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.residencecare.backend.modules.history.domain.AbstractHistoryRecord;
import com.residencecare.backend.modules.history.domain.ChangeKind;
import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.history.infrastructure.persistence.DeviceHistoryRepository;
import com.residencecare.backend.modules.history.infrastructure.persistence.HistoryLedgerRepository;
import com.residencecare.backend.modules.history.infrastructure.persistence.MeasurementHistoryRepository;
import com.residencecare.backend.modules.history.infrastructure.persistence.ResidentHistoryRepository;
import com.residencecare.backend.modules.history.infrastructure.persistence.TaskApplicationHistoryRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class HistoryRecorder {

    private final Map<TrackedEntityType, HistoryLedgerRepository<? extends AbstractHistoryRecord>> ledgers =
            new EnumMap<>(TrackedEntityType.class);

    public HistoryRecorder(
            ResidentHistoryRepository residentHistoryRepository,
            DeviceHistoryRepository deviceHistoryRepository,
            MeasurementHistoryRepository measurementHistoryRepository,
            TaskApplicationHistoryRepository taskApplicationHistoryRepository
    ) {
        ledgers.put(TrackedEntityType.RESIDENT, residentHistoryRepository);
        ledgers.put(TrackedEntityType.DEVICE, deviceHistoryRepository);
        ledgers.put(TrackedEntityType.MEASUREMENT, measurementHistoryRepository);
        ledgers.put(TrackedEntityType.TASK_APPLICATION, taskApplicationHistoryRepository);
    }

    /**
     * Appends one ledger row. Must join the transaction of the entity write it describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(
            TrackedEntityType type,
            UUID entityId,
            ChangeKind kind,
            Map<String, Object> snapshot,
            Map<String, Object> previousSnapshot,
            UUID actorId,
            OffsetDateTime recordedAt
    ) {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(snapshot, "snapshot is required");

        AbstractHistoryRecord record = type.newRecord();
        record.setEntityId(entityId);
        record.setChangeKind(kind);
        record.setSnapshot(snapshot);
        record.setPreviousSnapshot(kind == ChangeKind.UPDATE ? previousSnapshot : null);
        record.setActorId(actorId);
        record.setRecordedAt(recordedAt);
        ledger(type).save(record);
    }

    @Transactional(readOnly = true)
    public List<HistoryEntry> historyOf(TrackedEntityType type, UUID entityId) {
        return ledger(type).findByEntityIdOrderByIdAsc(entityId).stream()
                .map(HistoryEntry::from)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private HistoryLedgerRepository<AbstractHistoryRecord> ledger(TrackedEntityType type) {
        return (HistoryLedgerRepository<AbstractHistoryRecord>) ledgers.get(type);
    }

    public record HistoryEntry(
            long sequence,
            UUID entityId,
            ChangeKind changeKind,
            Map<String, Object> snapshot,
            Map<String, Object> previousSnapshot,
            UUID actorId,
            OffsetDateTime recordedAt
    ) {

        static HistoryEntry from(AbstractHistoryRecord record) {
            return new HistoryEntry(
                    record.getId(),
                    record.getEntityId(),
                    record.getChangeKind(),
                    record.getSnapshot(),
                    record.getPreviousSnapshot(),
                    record.getActorId(),
                    record.getRecordedAt()
            );
        }
    }
}
