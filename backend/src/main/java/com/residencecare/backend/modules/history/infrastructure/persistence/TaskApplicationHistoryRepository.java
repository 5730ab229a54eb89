package com.residencecare.backend.modules.history.infrastructure.persistence;

import com.residencecare.backend.modules.history.domain.TaskApplicationHistory;

public interface TaskApplicationHistoryRepository extends HistoryLedgerRepository<TaskApplicationHistory> {
}
