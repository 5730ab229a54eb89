package com.residencecare.backend.modules.resident.application;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.history.domain.TrackedEntityType;
import com.residencecare.backend.modules.lifecycle.application.EntityLifecycleEngine;
import com.residencecare.backend.modules.lifecycle.application.LifecycleDescriptor;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.resident.domain.ResidentStatus;
import com.residencecare.backend.modules.resident.infrastructure.persistence.ResidentRepository;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class ResidentService {

    private final EntityLifecycleEngine engine;
    private final ResidentRepository residentRepository;
    private final LifecycleDescriptor<Resident> residents;

    public ResidentService(
            EntityLifecycleEngine engine,
            ResidentRepository residentRepository,
            BedAssignmentGuard bedAssignmentGuard
    ) {
        this.engine = engine;
        this.residentRepository = residentRepository;
        List<MutationGuard<? super Resident>> guards = List.of(bedAssignmentGuard);
        this.residents = LifecycleDescriptor.tracked(TrackedEntityType.RESIDENT, residentRepository, guards);
    }

    public Resident admit(@NotNull UUID residenceId, @Valid ResidentCommand command, @NotNull UUID actorId) {
        Resident resident = new Resident();
        resident.setResidenceId(residenceId);
        command.applyTo(resident);
        return engine.insert(residents, resident, actorId);
    }

    /**
     * Replaces the mutable state of the resident with {@code command}.
     */
    public Resident update(@NotNull UUID residentId, @Valid ResidentCommand command, @NotNull UUID actorId) {
        return engine.update(residents, residentId, command::applyTo, actorId);
    }

    /**
     * Moves the resident to {@code bedId}, or releases its bed when {@code bedId} is null.
     */
    public Resident assignBed(@NotNull UUID residentId, UUID bedId, @NotNull UUID actorId) {
        return engine.update(residents, residentId, resident -> resident.setBedId(bedId), actorId);
    }

    public Resident changeStatus(@NotNull UUID residentId, @NotNull ResidentStatus status, @NotNull UUID actorId) {
        return engine.update(residents, residentId, resident -> resident.setStatus(status), actorId);
    }

    public Resident softDelete(@NotNull UUID residentId, @NotNull UUID actorId) {
        return engine.softDelete(residents, residentId, actorId);
    }

    @Transactional(readOnly = true)
    public Resident findById(UUID residentId) {
        return residentRepository.findById(residentId)
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound("resident", residentId));
    }

    @Transactional(readOnly = true)
    public List<Resident> activeResidents(UUID residenceId) {
        return residentRepository.findByResidenceIdAndDeletedAtIsNullOrderByFullNameAsc(residenceId);
    }

    public record ResidentCommand(
            @NotBlank @Size(max = 200) String fullName,
            @NotNull @PastOrPresent LocalDate birthDate,
            @Size(max = 16) String sex,
            @Size(max = 2000) String comments,
            @NotNull ResidentStatus status,
            UUID bedId
    ) {

        void applyTo(Resident resident) {
            resident.setFullName(fullName.trim());
            resident.setBirthDate(birthDate);
            resident.setSex(sex);
            resident.setComments(comments);
            resident.setStatus(status);
            resident.setBedId(bedId);
        }
    }
}
