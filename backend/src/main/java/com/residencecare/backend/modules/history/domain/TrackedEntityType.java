package com.residencecare.backend.modules.history.domain;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The closed set of historized entity types, each bound to its own ledger table.
 * Everything else in the store is only timestamp-guarded.
 */
public enum TrackedEntityType {
    RESIDENT("resident", ResidentHistory::new),
    DEVICE("device", DeviceHistory::new),
    MEASUREMENT("measurement", MeasurementHistory::new),
    TASK_APPLICATION("task_application", TaskApplicationHistory::new);

    private final String entityName;
    private final Supplier<? extends AbstractHistoryRecord> recordFactory;

    TrackedEntityType(String entityName, Supplier<? extends AbstractHistoryRecord> recordFactory) {
        this.entityName = entityName;
        this.recordFactory = recordFactory;
    }

    public String entityName() {
        return entityName;
    }

    public AbstractHistoryRecord newRecord() {
        return recordFactory.get();
    }

    public static Optional<TrackedEntityType> fromEntityName(String entityName) {
        return Arrays.stream(values())
                .filter(type -> type.entityName.equalsIgnoreCase(entityName))
                .findFirst();
    }
}
