package com.residencecare.backend.modules.history.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.history.domain.AbstractHistoryRecord;

import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.Repository;

/**
 * Append and read only: ledgers expose no update or delete operation.
 */
@NoRepositoryBean
public interface HistoryLedgerRepository<H extends AbstractHistoryRecord> extends Repository<H, Long> {

    <S extends H> S save(S record);

    List<H> findByEntityIdOrderByIdAsc(UUID entityId);
}
