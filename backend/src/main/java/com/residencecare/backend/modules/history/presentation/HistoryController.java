package com.residencecare.backend.modules.history.presentation;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.global.error.ProblemException;
import com.residencecare.backend.modules.history.application.HistoryRecorder;
import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.history.presentation.dto.HistoryEntryResponse;
import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HistoryController {

    private final HistoryRecorder historyRecorder;

    public HistoryController(HistoryRecorder historyRecorder) {
        this.historyRecorder = historyRecorder;
    }

    @Operation(summary = "History ledger of one entity, oldest first")
    @GetMapping("/history/{entityType}/{entityId}")
    public List<HistoryEntryResponse> history(@PathVariable String entityType, @PathVariable UUID entityId) {
        TrackedEntityType type = TrackedEntityType.fromEntityName(entityType)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "history.untracked_entity_type",
                        entityType + " has no history ledger"));
        return historyRecorder.historyOf(type, entityId).stream()
                .map(HistoryEntryResponse::from)
                .toList();
    }
}
