package com.residencecare.backend.modules.lifecycle.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

import com.residencecare.backend.modules.eventlog.application.EventLogService;
import com.residencecare.backend.modules.eventlog.application.EventLogService.EventLogCommand;
import com.residencecare.backend.modules.history.application.HistoryRecorder;
import com.residencecare.backend.modules.history.domain.ChangeKind;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;
import com.residencecare.backend.modules.lifecycle.domain.MutationOperation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The guarded mutation pipeline. Each call is one transaction:
 * guards, entity write, history append and event append commit together or not at all.
 */
@Service
public class EntityLifecycleEngine {

    public static final String PAYLOAD_SNAPSHOT = "snapshot";
    public static final String PAYLOAD_PREVIOUS_SNAPSHOT = "previous_snapshot";

    private static final Logger log = LoggerFactory.getLogger(EntityLifecycleEngine.class);

    private final LifecycleTransactionCoordinator coordinator;
    private final HistoryRecorder historyRecorder;
    private final EventLogService eventLogService;
    private final TimestampGuard timestampGuard;
    private final Clock clock;

    public EntityLifecycleEngine(
            LifecycleTransactionCoordinator coordinator,
            HistoryRecorder historyRecorder,
            EventLogService eventLogService,
            TimestampGuard timestampGuard,
            Clock clock
    ) {
        this.coordinator = coordinator;
        this.historyRecorder = historyRecorder;
        this.eventLogService = eventLogService;
        this.timestampGuard = timestampGuard;
        this.clock = clock;
    }

    public <T extends LifecycleEntity> T insert(LifecycleDescriptor<T> descriptor, T entity, UUID actorId) {
        Objects.requireNonNull(actorId, "actorId is required");
        OffsetDateTime now = now();
        T saved = coordinator.execute(descriptor.entityName(), MutationOperation.INSERT, () -> {
            Mutation<T> mutation = Mutation.insert(entity, actorId, now);
            runGuards(descriptor, mutation);
            T persisted = descriptor.repository().saveAndFlush(entity);
            recordTrail(descriptor, mutation, persisted, ChangeKind.CREATE, persisted.toSnapshot(), null);
            return persisted;
        });
        log.debug("Inserted {} {} by {}", descriptor.entityName(), saved.getId(), actorId);
        return saved;
    }

    /**
     * Loads the row, applies {@code changes} to it and runs it through the pipeline.
     */
    public <T extends LifecycleEntity> T update(LifecycleDescriptor<T> descriptor, UUID id, Consumer<T> changes,
                                                UUID actorId) {
        return update(descriptor, id, changes, actorId, now());
    }

    /**
     * Sets the soft-delete marker. Recorded as an update: the row stays in the store.
     */
    public <T extends LifecycleEntity> T softDelete(LifecycleDescriptor<T> descriptor, UUID id, UUID actorId) {
        OffsetDateTime now = now();
        return update(descriptor, id, entity -> entity.softDelete(now), actorId, now);
    }

    private <T extends LifecycleEntity> T update(LifecycleDescriptor<T> descriptor, UUID id, Consumer<T> changes,
                                                 UUID actorId, OffsetDateTime now) {
        Objects.requireNonNull(actorId, "actorId is required");
        T saved = coordinator.execute(descriptor.entityName(), MutationOperation.UPDATE, () -> {
            T entity = load(descriptor, id);
            Map<String, Object> before = entity.toSnapshot();
            changes.accept(entity);
            Mutation<T> mutation = Mutation.update(entity, before, actorId, now);
            runGuards(descriptor, mutation);
            T persisted = descriptor.repository().saveAndFlush(entity);
            recordTrail(descriptor, mutation, persisted, ChangeKind.UPDATE, persisted.toSnapshot(), before);
            return persisted;
        });
        log.debug("Updated {} {} by {}", descriptor.entityName(), id, actorId);
        return saved;
    }

    /**
     * Physically removes the row; the final snapshot survives in the history ledger.
     */
    public <T extends LifecycleEntity> void delete(LifecycleDescriptor<T> descriptor, UUID id, UUID actorId) {
        Objects.requireNonNull(actorId, "actorId is required");
        OffsetDateTime now = now();
        coordinator.execute(descriptor.entityName(), MutationOperation.DELETE, () -> {
            T entity = load(descriptor, id);
            Map<String, Object> last = entity.toSnapshot();
            Mutation<T> mutation = Mutation.delete(entity, last, actorId, now);
            descriptor.repository().delete(entity);
            descriptor.repository().flush();
            recordTrail(descriptor, mutation, entity, ChangeKind.DELETE, last, null);
            return null;
        });
        log.debug("Deleted {} {} by {}", descriptor.entityName(), id, actorId);
    }

    // row lock held until commit; a concurrent writer reloads after us
    private <T extends LifecycleEntity> T load(LifecycleDescriptor<T> descriptor, UUID id) {
        return descriptor.repository().findByIdForUpdate(id)
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound(descriptor.entityName(), id));
    }

    private <T extends LifecycleEntity> void runGuards(LifecycleDescriptor<T> descriptor, Mutation<T> mutation) {
        List<MutationGuard<? super T>> pipeline = new ArrayList<>(descriptor.guards());
        pipeline.add(timestampGuard);
        for (MutationGuard<? super T> guard : pipeline) {
            guard.check(mutation);
        }
    }

    private <T extends LifecycleEntity> void recordTrail(
            LifecycleDescriptor<T> descriptor,
            Mutation<T> mutation,
            T entity,
            ChangeKind kind,
            Map<String, Object> snapshot,
            Map<String, Object> previousSnapshot
    ) {
        if (descriptor.isTracked()) {
            historyRecorder.record(descriptor.trackedType(), entity.getId(), kind, snapshot, previousSnapshot,
                    mutation.actorId(), mutation.occurredAt());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(PAYLOAD_SNAPSHOT, snapshot);
            if (previousSnapshot != null) {
                payload.put(PAYLOAD_PREVIOUS_SNAPSHOT, previousSnapshot);
            }
            eventLogService.record(new EventLogCommand(
                    mutation.actorId(),
                    entity.getResidenceId(),
                    descriptor.entityName(),
                    entity.getId(),
                    kind.label(),
                    mutation.occurredAt(),
                    payload
            ));
        }
        for (Mutation.DerivedEvent derived : mutation.derivedEvents()) {
            eventLogService.record(new EventLogCommand(
                    mutation.actorId(),
                    entity.getResidenceId(),
                    descriptor.entityName(),
                    entity.getId(),
                    derived.action(),
                    mutation.occurredAt(),
                    derived.payload()
            ));
        }
    }

    private OffsetDateTime now() {
        // the store keeps microseconds; ledger rows must compare equal after a reload
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
