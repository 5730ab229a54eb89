package com.residencecare.backend.modules.lifecycle.application;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;
import com.residencecare.backend.modules.lifecycle.domain.MutationOperation;

/**
 * One pending write as seen by the guards: the entity in its proposed state, the
 * snapshot it had before the write (updates and deletes only), who is acting and the
 * single timestamp every row written by this mutation carries.
 */
public final class Mutation<T extends LifecycleEntity> {

    private final MutationOperation operation;
    private final T entity;
    private final Map<String, Object> previousSnapshot;
    private final UUID actorId;
    private final OffsetDateTime occurredAt;
    private final List<DerivedEvent> derivedEvents = new ArrayList<>();

    private Mutation(MutationOperation operation, T entity, Map<String, Object> previousSnapshot, UUID actorId,
                     OffsetDateTime occurredAt) {
        this.operation = Objects.requireNonNull(operation, "operation is required");
        this.entity = Objects.requireNonNull(entity, "entity is required");
        this.previousSnapshot = previousSnapshot;
        this.actorId = Objects.requireNonNull(actorId, "actorId is required");
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt is required");
    }

    public static <T extends LifecycleEntity> Mutation<T> insert(T entity, UUID actorId, OffsetDateTime occurredAt) {
        return new Mutation<>(MutationOperation.INSERT, entity, null, actorId, occurredAt);
    }

    public static <T extends LifecycleEntity> Mutation<T> update(T entity, Map<String, Object> previousSnapshot,
                                                                UUID actorId, OffsetDateTime occurredAt) {
        Objects.requireNonNull(previousSnapshot, "previousSnapshot is required for updates");
        return new Mutation<>(MutationOperation.UPDATE, entity, previousSnapshot, actorId, occurredAt);
    }

    public static <T extends LifecycleEntity> Mutation<T> delete(T entity, Map<String, Object> previousSnapshot,
                                                                UUID actorId, OffsetDateTime occurredAt) {
        return new Mutation<>(MutationOperation.DELETE, entity, previousSnapshot, actorId, occurredAt);
    }

    public MutationOperation operation() {
        return operation;
    }

    public T entity() {
        return entity;
    }

    public Map<String, Object> previousSnapshot() {
        return previousSnapshot;
    }

    public Object previousValue(String column) {
        return previousSnapshot != null ? previousSnapshot.get(column) : null;
    }

    public UUID actorId() {
        return actorId;
    }

    public OffsetDateTime occurredAt() {
        return occurredAt;
    }

    public boolean isInsert() {
        return operation == MutationOperation.INSERT;
    }

    public boolean isUpdate() {
        return operation == MutationOperation.UPDATE;
    }

    /**
     * Queues an event-log row that has no history counterpart. It is written after the
     * entity row, in the same transaction.
     */
    public void emit(String action, Map<String, Object> payload) {
        derivedEvents.add(new DerivedEvent(action, payload));
    }

    public List<DerivedEvent> derivedEvents() {
        return Collections.unmodifiableList(derivedEvents);
    }

    public record DerivedEvent(String action, Map<String, Object> payload) {

        public DerivedEvent {
            Objects.requireNonNull(action, "action is required");
        }
    }
}
