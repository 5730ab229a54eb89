package com.residencecare.backend.modules.tag.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.tag.domain.ResidentTag;
import com.residencecare.backend.modules.tag.domain.ResidentTagId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ResidentTagRepository extends JpaRepository<ResidentTag, ResidentTagId> {

    List<ResidentTag> findByIdResidentIdOrderByAssignedAtAsc(UUID residentId);

    /**
     * Returns 0 when the pair already exists, including when a concurrent assignment
     * committed it first.
     */
    @Modifying
    @Query(value = """
            insert into resident_tag (resident_id, tag_id, assigned_by, assigned_at)
            values (:residentId, :tagId, :assignedBy, :assignedAt)
            on conflict (resident_id, tag_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("residentId") UUID residentId,
                       @Param("tagId") UUID tagId,
                       @Param("assignedBy") UUID assignedBy,
                       @Param("assignedAt") OffsetDateTime assignedAt);
}
