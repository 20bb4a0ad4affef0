package com.tau.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.tau.backend.modules.auth.application.IssuedSession;

public record SessionTokenResponse(
        String token,
        OffsetDateTime expiresAt,
        UserResponse user
) {

    public static SessionTokenResponse from(IssuedSession issued) {
        return new SessionTokenResponse(
                issued.rawToken(),
                issued.session().getExpiresAt(),
                UserResponse.from(issued.session().getUser())
        );
    }
}
