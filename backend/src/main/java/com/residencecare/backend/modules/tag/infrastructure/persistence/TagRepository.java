package com.residencecare.backend.modules.tag.infrastructure.persistence;

import com.residencecare.backend.modules.lifecycle.infrastructure.persistence.LifecycleRepository;
import com.residencecare.backend.modules.tag.domain.Tag;

public interface TagRepository extends LifecycleRepository<Tag> {
}
