package com.tau.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.tau.backend.modules.auth.domain.AuthenticatedUser;
import com.tau.backend.modules.auth.domain.PhotoUrl;
import com.tau.backend.modules.auth.domain.User;

public record UserResponse(
        UUID id,
        String handle,
        PhotoUrl profilePicture,
        boolean infrastructureAdmin
) {

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getHandle(), user.getProfilePicture(), user.isInfrastructureAdmin());
    }

    public static UserResponse fromPrincipal(AuthenticatedUser user) {
        return new UserResponse(user.id(), user.handle(), user.profilePicture(), user.infrastructureAdmin());
    }
}
