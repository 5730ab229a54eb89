package com.residencecare.backend.modules.eventlog.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.eventlog.domain.EventLog;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Append and read only.
 */
public interface EventLogRepository extends Repository<EventLog, Long> {

    EventLog save(EventLog eventLog);

    @Query("""
            select e from EventLog e
             where e.residenceId = :residenceId
               and e.occurredAt >= :since
             order by e.occurredAt desc, e.id desc
            """)
    List<EventLog> findResidenceEventsSince(
            @Param("residenceId") UUID residenceId,
            @Param("since") OffsetDateTime since
    );

    List<EventLog> findByEntityTypeAndEntityIdOrderByIdAsc(String entityType, UUID entityId);

    long count();
}
