package com.residencecare.backend.modules.residence.domain;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.residencecare.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Tenancy root. Contact fields hold ciphertext produced by the caller and are never
 * interpreted here.
 */
@Entity
@Table(name = "residence")
public class Residence extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "address", length = 500)
    private String address;

    @Column(name = "phone_encrypted")
    private byte[] phoneEncrypted;

    @Column(name = "email_encrypted")
    private byte[] emailEncrypted;

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public UUID getResidenceId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public byte[] getPhoneEncrypted() {
        return phoneEncrypted;
    }

    public void setPhoneEncrypted(byte[] phoneEncrypted) {
        this.phoneEncrypted = phoneEncrypted;
    }

    public byte[] getEmailEncrypted() {
        return emailEncrypted;
    }

    public void setEmailEncrypted(byte[] emailEncrypted) {
        this.emailEncrypted = emailEncrypted;
    }

    @Override
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", format(id));
        snapshot.put("name", name);
        snapshot.put("address", address);
        snapshot.put("phone_encrypted", encode(phoneEncrypted));
        snapshot.put("email_encrypted", encode(emailEncrypted));
        snapshot.put("created_at", format(getCreatedAt()));
        snapshot.put("updated_at", format(getUpdatedAt()));
        snapshot.put("deleted_at", format(getDeletedAt()));
        return snapshot;
    }

    private static String encode(byte[] value) {
        return value != null ? Base64.getEncoder().encodeToString(value) : null;
    }
}
