package com.residencecare.backend.modules.residence.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.residencecare.backend.modules.residence.domain.Bed;

public interface BedRepository extends LifecycleRepository<Bed> {

    List<Bed> findByRoomIdAndDeletedAtIsNullOrderByNameAsc(UUID roomId);
}
