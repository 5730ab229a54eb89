package com.residencecare.backend.modules.history.infrastructure.persistence;

import com.residencecare.backend.modules.history.domain.ResidentHistory;

public interface ResidentHistoryRepository extends HistoryLedgerRepository<ResidentHistory> {
}
