package com.tau.backend.modules.auth.domain;

import java.util.UUID;

/**
 * Identity resolved by authentication and stored as the security principal.
 * {@code infrastructureAdmin} is decided once, here, from the reserved id.
 */
public record AuthenticatedUser(UUID id, String handle, PhotoUrl profilePicture, boolean infrastructureAdmin) {

    public static AuthenticatedUser from(User user) {
        return new AuthenticatedUser(
                user.getId(),
                user.getHandle(),
                user.getProfilePicture(),
                user.isInfrastructureAdmin()
        );
    }
}
