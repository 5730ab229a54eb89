package com.residencecare.backend.modules.task.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six ordered status labels of a task template, addressed by a 1-based index.
 */
public enum TaskStatusSlot {
    STATUS_1(1),
    STATUS_2(2),
    STATUS_3(3),
    STATUS_4(4),
    STATUS_5(5),
    STATUS_6(6);

    public static final int MIN_INDEX = 1;
    public static final int MAX_INDEX = 6;

    private final int index;

    TaskStatusSlot(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }

    public static Optional<TaskStatusSlot> fromIndex(int index) {
        return Arrays.stream(values())
                .filter(slot -> slot.index == index)
                .findFirst();
    }
}
