package com.tau.backend.modules.auth.application;

import com.tau.backend.modules.auth.domain.UserSession;

/**
 * A freshly created session and its raw token. The raw token is not recoverable later.
 */
public record IssuedSession(UserSession session, String rawToken) {
}
