package com.residencecare.backend.modules.resident.application;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.application.Mutation;
import com.residencecare.backend.modules.lifecycle.application.MutationGuard;
import com.residencecare.backend.modules.lifecycle.application.ResidenceScope;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.residence.domain.Bed;
import com.residencecare.backend.modules.residence.infrastructure.persistence.BedRepository;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.resident.domain.ResidentStatus;

import org.springframework.stereotype.Component;

/**
 * Couples a resident's bed to its status and tenancy.
 * <ul>
 *     <li>leaving {@code ACTIVE} stamps {@code status_changed_at} and the soft-delete marker and releases the bed;</li>
 *     <li>returning to {@code ACTIVE} clears the soft-delete marker, soft-deleting an active resident releases the bed;</li>
 *     <li>a bed must exist, be live and belong to the resident's residence;</li>
 *     <li>a changed bed on update emits one {@code assign_bed} event.</li>
 * </ul>
 * Exclusive occupancy is left to the {@code uq_resident_active_bed} index.
 */
@Component
public class BedAssignmentGuard implements MutationGuard<Resident> {

    public static final String ASSIGN_BED_ACTION = "assign_bed";
    public static final String OLD_BED_ID = "old_bed_id";
    public static final String NEW_BED_ID = "new_bed_id";

    private final BedRepository bedRepository;

    public BedAssignmentGuard(BedRepository bedRepository) {
        this.bedRepository = bedRepository;
    }

    @Override
    public void check(Mutation<? extends Resident> mutation) {
        Resident resident = mutation.entity();
        OffsetDateTime now = mutation.occurredAt();

        Object previousStatus = mutation.previousValue("status");
        if (!resident.getStatus().isActive()) {
            boolean leavingActive = mutation.isUpdate() && ResidentStatus.ACTIVE.name().equals(previousStatus);
            if (resident.getStatusChangedAt() == null || leavingActive) {
                resident.setStatusChangedAt(now);
            }
            resident.softDelete(now);
            resident.setBedId(null);
        } else {
            boolean readmitted = mutation.isUpdate() && previousStatus != null
                    && !ResidentStatus.ACTIVE.name().equals(previousStatus);
            if (readmitted) {
                resident.restore();
            }
            if (resident.isDeleted()) {
                releaseBedOfDeletedResident(mutation, resident);
            } else if (resident.getBedId() != null) {
                UUID bedId = resident.getBedId();
                Bed bed = bedRepository.findById(bedId)
                        .filter(candidate -> !candidate.isDeleted())
                        .orElseThrow(() -> EntityLifecycleException.referenceNotFound("bed", bedId));
                ResidenceScope.requireSameResidence(resident.getResidenceId(), "bed", bedId, bed.getResidenceId());
            }
        }

        if (mutation.isUpdate()) {
            Object previousBed = mutation.previousValue("bed_id");
            String currentBed = resident.getBedId() != null ? resident.getBedId().toString() : null;
            if (!Objects.equals(previousBed, currentBed)) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(OLD_BED_ID, previousBed);
                payload.put(NEW_BED_ID, currentBed);
                mutation.emit(ASSIGN_BED_ACTION, payload);
            }
        }
    }

    // a soft-deleted row is outside the occupancy index, so it must not hold a bed
    private static void releaseBedOfDeletedResident(Mutation<? extends Resident> mutation, Resident resident) {
        if (resident.getBedId() == null) {
            return;
        }
        if (mutation.previousValue("deleted_at") == null) {
            resident.setBedId(null);
            return;
        }
        throw EntityLifecycleException.invalidValue(
                "resident " + resident.getId() + " is deleted and cannot be assigned a bed");
    }
}
