package com.residencecare.backend.modules.tag.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.application.EntityLifecycleEngine;
import com.residencecare.backend.modules.lifecycle.application.LifecycleDescriptor;
import com.residencecare.backend.modules.lifecycle.application.LifecycleTransactionCoordinator;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.MutationOperation;
import com.residencecare.backend.modules.resident.infrastructure.persistence.ResidentRepository;
import com.residencecare.backend.modules.tag.domain.ResidentTag;
import com.residencecare.backend.modules.tag.domain.ResidentTagId;
import com.residencecare.backend.modules.tag.domain.Tag;
import com.residencecare.backend.modules.tag.infrastructure.persistence.ResidentTagRepository;
import com.residencecare.backend.modules.tag.infrastructure.persistence.TagRepository;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class TagService {

    private static final Logger log = LoggerFactory.getLogger(TagService.class);
    private static final String RESIDENT_TAG = "resident_tag";

    private final EntityLifecycleEngine engine;
    private final LifecycleTransactionCoordinator coordinator;
    private final TagRepository tagRepository;
    private final ResidentTagRepository residentTagRepository;
    private final ResidentRepository residentRepository;
    private final Clock clock;
    private final LifecycleDescriptor<Tag> tags;

    public TagService(
            EntityLifecycleEngine engine,
            LifecycleTransactionCoordinator coordinator,
            TagRepository tagRepository,
            ResidentTagRepository residentTagRepository,
            ResidentRepository residentRepository,
            Clock clock
    ) {
        this.engine = engine;
        this.coordinator = coordinator;
        this.tagRepository = tagRepository;
        this.residentTagRepository = residentTagRepository;
        this.residentRepository = residentRepository;
        this.clock = clock;
        this.tags = LifecycleDescriptor.untracked("tag", tagRepository);
    }

    public Tag createTag(@NotBlank @Size(max = 100) String name, @NotNull UUID actorId) {
        Tag tag = new Tag();
        tag.setName(name.trim());
        return engine.insert(tags, tag, actorId);
    }

    public Tag renameTag(@NotNull UUID tagId, @NotBlank @Size(max = 100) String name, @NotNull UUID actorId) {
        return engine.update(tags, tagId, tag -> tag.setName(name.trim()), actorId);
    }

    public Tag softDeleteTag(@NotNull UUID tagId, @NotNull UUID actorId) {
        return engine.softDelete(tags, tagId, actorId);
    }

    /**
     * Attaches the tag to the resident. Assigning an already assigned tag is a no-op.
     */
    public ResidentTag assign(@NotNull UUID residentId, @NotNull UUID tagId, @NotNull UUID actorId) {
        Objects.requireNonNull(actorId, "actorId is required");
        return coordinator.execute(RESIDENT_TAG, MutationOperation.INSERT, () -> {
            residentRepository.findById(residentId)
                    .filter(resident -> !resident.isDeleted())
                    .orElseThrow(() -> EntityLifecycleException.referenceNotFound("resident", residentId));
            tagRepository.findById(tagId)
                    .filter(tag -> !tag.isDeleted())
                    .orElseThrow(() -> EntityLifecycleException.referenceNotFound("tag", tagId));

            OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
            if (residentTagRepository.insertIfAbsent(residentId, tagId, actorId, now) > 0) {
                log.debug("Assigned tag {} to resident {} by {}", tagId, residentId, actorId);
            }
            ResidentTagId id = new ResidentTagId(residentId, tagId);
            return residentTagRepository.findById(id)
                    .orElseThrow(() -> new IllegalStateException(
                            "resident_tag (" + residentId + ", " + tagId + ") missing after insert"));
        });
    }

    /**
     * Removes the association row. Returns whether a row was removed.
     */
    public boolean unassign(@NotNull UUID residentId, @NotNull UUID tagId) {
        return coordinator.execute(RESIDENT_TAG, MutationOperation.DELETE, () -> {
            ResidentTagId id = new ResidentTagId(residentId, tagId);
            if (!residentTagRepository.existsById(id)) {
                return false;
            }
            residentTagRepository.deleteById(id);
            residentTagRepository.flush();
            return true;
        });
    }

    @Transactional(readOnly = true)
    public List<UUID> tagIdsOf(UUID residentId) {
        return residentTagRepository.findByIdResidentIdOrderByAssignedAtAsc(residentId).stream()
                .map(residentTag -> residentTag.getId().getTagId())
                .toList();
    }
}
