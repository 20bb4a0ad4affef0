package com.tau.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record LoginLinkResponse(String link, OffsetDateTime expiresAt) {
}
