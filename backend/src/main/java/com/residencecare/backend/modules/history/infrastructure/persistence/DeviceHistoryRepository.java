package com.residencecare.backend.modules.history.infrastructure.persistence;

import com.residencecare.backend.modules.history.domain.DeviceHistory;

public interface DeviceHistoryRepository extends HistoryLedgerRepository<DeviceHistory> {
}
