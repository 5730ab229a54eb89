package com.residencecare.backend.modules.eventlog.presentation;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.eventlog.application.EventLogService;
import com.residencecare.backend.modules.eventlog.presentation.dto.EventLogResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EventLogController {

    private final EventLogService eventLogService;
    private final Clock clock;
    private final Duration defaultLookBack;

    public EventLogController(
            EventLogService eventLogService,
            Clock clock,
            @Value("${residencecare.event-log.default-look-back:P7D}") Duration defaultLookBack
    ) {
        this.eventLogService = eventLogService;
        this.clock = clock;
        this.defaultLookBack = defaultLookBack;
    }

    @Operation(summary = "Events of a residence, newest first")
    @GetMapping("/residences/{residenceId}/events")
    public List<EventLogResponse> residenceEvents(
            @PathVariable UUID residenceId,
            @Parameter(description = "Lower bound (inclusive); defaults to the configured look-back window")
            @RequestParam(name = "since", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime since
    ) {
        OffsetDateTime lowerBound = since != null ? since : OffsetDateTime.now(clock).minus(defaultLookBack);
        return eventLogService.eventsForResidence(residenceId, lowerBound).stream()
                .map(EventLogResponse::from)
                .toList();
    }
}
