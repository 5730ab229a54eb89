package com.residencecare.backend.modules.history.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.residencecare.backend.modules.history.application.HistoryRecorder.HistoryEntry;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntryResponse(
        long sequence,
        UUID entityId,
        String changeKind,
        Map<String, Object> snapshot,
        Map<String, Object> previousSnapshot,
        UUID actorId,
        OffsetDateTime recordedAt
) {

    public static HistoryEntryResponse from(HistoryEntry entry) {
        return new HistoryEntryResponse(
                entry.sequence(),
                entry.entityId(),
                entry.changeKind().label(),
                entry.snapshot(),
                entry.previousSnapshot(),
                entry.actorId(),
                entry.recordedAt()
        );
    }
}
