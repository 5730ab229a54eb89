package com.residencecare.backend.modules.history.infrastructure.persistence;

import com.residencecare.backend.modules.history.domain.MeasurementHistory;

public interface MeasurementHistoryRepository extends HistoryLedgerRepository<MeasurementHistory> {
}
