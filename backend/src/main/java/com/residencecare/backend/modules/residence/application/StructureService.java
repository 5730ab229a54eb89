package com.residencecare.backend.modules.residence.application;

import java.util.List;
import java.util.UUID;

import com.residencecare.backend.modules.lifecycle.application.EntityLifecycleEngine;
import com.residencecare.backend.modules.lifecycle.application.LifecycleDescriptor;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.LifecycleEntity;
import com.residencecare.backend.modules.residence.domain.Bed;
import com.residencecare.backend.modules.residence.domain.Floor;
import com.residencecare.backend.modules.residence.domain.Residence;
import com.residencecare.backend.modules.residence.domain.Room;
import com.residencecare.backend.modules.residence.infrastructure.persistence.BedRepository;
import com.residencecare.backend.modules.residence.infrastructure.persistence.FloorRepository;
import com.residencecare.backend.modules.residence.infrastructure.persistence.ResidenceRepository;
import com.residencecare.backend.modules.residence.infrastructure.persistence.RoomRepository;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Residence, floor, room and bed maintenance. These rows are timestamp-guarded only;
 * they have no history ledger.
 */
@Service
@Validated
public class StructureService {

    private final EntityLifecycleEngine engine;
    private final BedRepository bedRepository;
    private final LifecycleDescriptor<Residence> residences;
    private final LifecycleDescriptor<Floor> floors;
    private final LifecycleDescriptor<Room> rooms;
    private final LifecycleDescriptor<Bed> beds;

    public StructureService(
            EntityLifecycleEngine engine,
            ResidenceRepository residenceRepository,
            FloorRepository floorRepository,
            RoomRepository roomRepository,
            BedRepository bedRepository
    ) {
        this.engine = engine;
        this.bedRepository = bedRepository;
        this.residences = LifecycleDescriptor.untracked("residence", residenceRepository);
        this.floors = LifecycleDescriptor.untracked("floor", floorRepository);
        this.rooms = LifecycleDescriptor.untracked("room", roomRepository);
        this.beds = LifecycleDescriptor.untracked("bed", bedRepository);
    }

    public Residence createResidence(@Valid ResidenceCommand command, @NotNull UUID actorId) {
        Residence residence = new Residence();
        command.applyTo(residence);
        return engine.insert(residences, residence, actorId);
    }

    public Residence updateResidence(@NotNull UUID residenceId, @Valid ResidenceCommand command,
                                     @NotNull UUID actorId) {
        return engine.update(residences, residenceId, command::applyTo, actorId);
    }

    public Residence softDeleteResidence(@NotNull UUID residenceId, @NotNull UUID actorId) {
        return engine.softDelete(residences, residenceId, actorId);
    }

    public Floor createFloor(@NotNull UUID residenceId, @Valid LocationCommand command, @NotNull UUID actorId) {
        Residence residence = requireLive(residences, residenceId);
        Floor floor = new Floor();
        floor.setResidenceId(residence.getId());
        floor.setName(command.name());
        return engine.insert(floors, floor, actorId);
    }

    public Room createRoom(@NotNull UUID floorId, @Valid LocationCommand command, @NotNull UUID actorId) {
        Floor floor = requireLive(floors, floorId);
        Room room = new Room();
        room.setResidenceId(floor.getResidenceId());
        room.setFloor(floor);
        room.setName(command.name());
        return engine.insert(rooms, room, actorId);
    }

    public Bed createBed(@NotNull UUID roomId, @Valid LocationCommand command, @NotNull UUID actorId) {
        Room room = requireLive(rooms, roomId);
        Bed bed = new Bed();
        bed.setResidenceId(room.getResidenceId());
        bed.setRoom(room);
        bed.setName(command.name());
        return engine.insert(beds, bed, actorId);
    }

    public Bed renameBed(@NotNull UUID bedId, @Valid LocationCommand command, @NotNull UUID actorId) {
        return engine.update(beds, bedId, bed -> bed.setName(command.name()), actorId);
    }

    public Bed softDeleteBed(@NotNull UUID bedId, @NotNull UUID actorId) {
        return engine.softDelete(beds, bedId, actorId);
    }

    @Transactional(readOnly = true)
    public List<Bed> bedsOfRoom(UUID roomId) {
        return bedRepository.findByRoomIdAndDeletedAtIsNullOrderByNameAsc(roomId);
    }

    private <T extends LifecycleEntity> T requireLive(LifecycleDescriptor<T> descriptor, UUID id) {
        return descriptor.repository().findById(id)
                .filter(entity -> !entity.isDeleted())
                .orElseThrow(() -> EntityLifecycleException.referenceNotFound(descriptor.entityName(), id));
    }

    public record ResidenceCommand(
            @NotBlank @Size(max = 200) String name,
            @Size(max = 500) String address,
            byte[] phoneEncrypted,
            byte[] emailEncrypted
    ) {

        void applyTo(Residence residence) {
            residence.setName(name.trim());
            residence.setAddress(address);
            residence.setPhoneEncrypted(phoneEncrypted);
            residence.setEmailEncrypted(emailEncrypted);
        }
    }

    public record LocationCommand(@NotBlank @Size(max = 100) String name) {
    }
}
