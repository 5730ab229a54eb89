package com.residencecare.backend.modules.eventlog.application;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.residencecare.backend.global.web.RequestIdFilter;
import com.residencecare.backend.modules.eventlog.domain.EventLog;
import com.residencecare.backend.modules.eventlog.infrastructure.persistence.EventLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EventLogService {

    private final EventLogRepository eventLogRepository;

    public EventLogService(EventLogRepository eventLogRepository) {
        this.eventLogRepository = eventLogRepository;
    }

    /**
     * Appends one event. Must join the transaction of the mutation it describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EventLog record(EventLogCommand command) {
        Objects.requireNonNull(command.entityType(), "entityType is required");
        Objects.requireNonNull(command.entityId(), "entityId is required");
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.occurredAt(), "occurredAt is required");

        EventLog eventLog = new EventLog();
        eventLog.setActorId(command.actorId());
        eventLog.setResidenceId(command.residenceId());
        eventLog.setEntityType(command.entityType());
        eventLog.setEntityId(command.entityId());
        eventLog.setAction(command.action());
        eventLog.setOccurredAt(command.occurredAt());
        eventLog.setCorrelationId(RequestIdFilter.currentRequestId());

        if (command.payload() != null && !command.payload().isEmpty()) {
            eventLog.setPayload(new LinkedHashMap<>(command.payload()));
        }

        return eventLogRepository.save(eventLog);
    }

    @Transactional(readOnly = true)
    public List<EventLog> eventsForResidence(UUID residenceId, OffsetDateTime since) {
        return eventLogRepository.findResidenceEventsSince(residenceId, since);
    }

    @Transactional(readOnly = true)
    public List<EventLog> eventsForEntity(String entityType, UUID entityId) {
        return eventLogRepository.findByEntityTypeAndEntityIdOrderByIdAsc(entityType, entityId);
    }

    public record EventLogCommand(
            UUID actorId,
            UUID residenceId,
            String entityType,
            UUID entityId,
            String action,
            OffsetDateTime occurredAt,
            Map<String, Object> payload
    ) {
    }
}
