package com.residencecare.backend.support;

import java.time.LocalDate;
import java.util.UUID;

import com.residencecare.backend.modules.residence.application.StructureService;
import com.residencecare.backend.modules.residence.application.StructureService.LocationCommand;
import com.residencecare.backend.modules.residence.application.StructureService.ResidenceCommand;
import com.residencecare.backend.modules.residence.domain.Bed;
import com.residencecare.backend.modules.residence.domain.Floor;
import com.residencecare.backend.modules.residence.domain.Residence;
import com.residencecare.backend.modules.residence.domain.Room;
import com.residencecare.backend.modules.resident.application.ResidentService;
import com.residencecare.backend.modules.resident.application.ResidentService.ResidentCommand;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.resident.domain.ResidentStatus;

import org.springframework.stereotype.Component;

/**
 * Builds residences with one floor and one room through the regular services.
 */
@Component
public class StructureFixtures {

    public static final UUID ACTOR_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");

    private final StructureService structureService;
    private final ResidentService residentService;

    public StructureFixtures(StructureService structureService, ResidentService residentService) {
        this.structureService = structureService;
        this.residentService = residentService;
    }

    public Site site(String residenceName) {
        Residence residence = structureService.createResidence(
                new ResidenceCommand(residenceName, "1 Main Street", null, null), ACTOR_ID);
        Floor floor = structureService.createFloor(residence.getId(), new LocationCommand("Ground"), ACTOR_ID);
        Room room = structureService.createRoom(floor.getId(), new LocationCommand("101"), ACTOR_ID);
        return new Site(residence.getId(), room.getId());
    }

    public Bed bed(Site site, String name) {
        return structureService.createBed(site.roomId(), new LocationCommand(name), ACTOR_ID);
    }

    public Resident resident(Site site, String fullName, UUID bedId) {
        return residentService.admit(site.residenceId(), residentCommand(fullName, ResidentStatus.ACTIVE, bedId),
                ACTOR_ID);
    }

    public static ResidentCommand residentCommand(String fullName, ResidentStatus status, UUID bedId) {
        return new ResidentCommand(fullName, LocalDate.of(1940, 5, 17), "F", null, status, bedId);
    }

    public record Site(UUID residenceId, UUID roomId) {
    }
}
