package com.residencecare.backend.modules.eventlog.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.residencecare.backend.modules.eventlog.domain.EventLog;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventLogResponse(
        long sequence,
        UUID actorId,
        UUID residenceId,
        String entityType,
        UUID entityId,
        String action,
        OffsetDateTime occurredAt,
        Map<String, Object> payload,
        String correlationId
) {

    public static EventLogResponse from(EventLog eventLog) {
        return new EventLogResponse(
                eventLog.getId(),
                eventLog.getActorId(),
                eventLog.getResidenceId(),
                eventLog.getEntityType(),
                eventLog.getEntityId(),
                eventLog.getAction(),
                eventLog.getOccurredAt(),
                eventLog.getPayload(),
                eventLog.getCorrelationId()
        );
    }
}
