package com.residencecare.backend.modules.tag.domain;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class ResidentTagId implements Serializable {

    @Column(name = "resident_id", nullable = false, columnDefinition = "uuid")
    private UUID residentId;

    @Column(name = "tag_id", nullable = false, columnDefinition = "uuid")
    private UUID tagId;

    protected ResidentTagId() {
    }

    public ResidentTagId(UUID residentId, UUID tagId) {
        this.residentId = residentId;
        this.tagId = tagId;
    }

    public UUID getResidentId() {
        return residentId;
    }

    public UUID getTagId() {
        return tagId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResidentTagId that)) {
            return false;
        }
        return Objects.equals(residentId, that.residentId) && Objects.equals(tagId, that.tagId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(residentId, tagId);
    }
}
