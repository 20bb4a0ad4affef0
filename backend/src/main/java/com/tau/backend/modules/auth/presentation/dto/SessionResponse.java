package com.tau.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.tau.backend.modules.auth.domain.UserSession;

/**
 * Session metadata for administrators. Never includes the token or its hash.
 */
public record SessionResponse(
        UUID id,
        UUID userId,
        String handle,
        OffsetDateTime issuedAt,
        OffsetDateTime expiresAt,
        OffsetDateTime lastAccessAt
) {

    public static SessionResponse from(UserSession session) {
        return new SessionResponse(
                session.getId(),
                session.getUser().getId(),
                session.getUser().getHandle(),
                session.getIssuedAt(),
                session.getExpiresAt(),
                session.getLastAccessAt()
        );
    }
}
