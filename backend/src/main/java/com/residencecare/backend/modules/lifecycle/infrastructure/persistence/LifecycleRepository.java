package com.residencecare.backend.modules.lifecycle.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

/**
 * Store of an engine-managed entity type. Updates and deletes load their row through
 * {@link #findByIdForUpdate}, so concurrent writers of one row are serialized and each
 * sees the state the previous one committed.
 */
@NoRepositoryBean
public interface LifecycleRepository<T extends LifecycleEntity> extends JpaRepository<T, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from #{#entityName} e where e.id = :id")
    Optional<T> findByIdForUpdate(@Param("id") UUID id);
}
