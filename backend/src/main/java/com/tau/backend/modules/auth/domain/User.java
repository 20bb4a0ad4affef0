package com.tau.backend.modules.auth.domain;

import java.util.UUID;

import com.tau.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Tau user account. Ids are assigned by the application so the infrastructure
 * administrator can occupy the reserved maximum UUID.
 */
@Entity
@Table(name = "users")
public class User extends AbstractTimestampedEntity {

    /** {@code ffffffff-ffff-ffff-ffff-ffffffffffff}, reserved for the built-in administrator. */
    public static final UUID INFRASTRUCTURE_ADMIN_ID = new UUID(-1L, -1L);
    public static final String INFRASTRUCTURE_ADMIN_HANDLE = "admin";

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "handle", nullable = false, unique = true, length = 100)
    private String handle;

    @Convert(converter = PhotoUrlConverter.class)
    @Column(name = "picture_link", length = 2048)
    private PhotoUrl profilePicture;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    protected User() {
    }

    public User(UUID id, String handle, String passwordHash) {
        this.id = id;
        this.handle = handle;
        this.passwordHash = passwordHash;
    }

    public static User create(String handle, String passwordHash) {
        return new User(UUID.randomUUID(), handle, passwordHash);
    }

    public static User infrastructureAdmin(String passwordHash) {
        return new User(INFRASTRUCTURE_ADMIN_ID, INFRASTRUCTURE_ADMIN_HANDLE, passwordHash);
    }

    public UUID getId() {
        return id;
    }

    public String getHandle() {
        return handle;
    }

    public void setHandle(String handle) {
        this.handle = handle;
    }

    public PhotoUrl getProfilePicture() {
        return profilePicture;
    }

    public void setProfilePicture(PhotoUrl profilePicture) {
        this.profilePicture = profilePicture;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean isInfrastructureAdmin() {
        return INFRASTRUCTURE_ADMIN_ID.equals(id);
    }
}
