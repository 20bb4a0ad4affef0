package com.tau.backend.modules.auth.application;

import java.util.Optional;

import com.tau.backend.modules.auth.domain.AuthenticatedUser;

/**
 * Outcome of a successful authentication. {@code renewedSessionToken} is present when the
 * caller authenticated with a session, so the web layer can re-issue the session cookie.
 */
public record AuthenticationResult(AuthenticatedUser user, Optional<String> renewedSessionToken) {

    public static AuthenticationResult withoutSession(AuthenticatedUser user) {
        return new AuthenticationResult(user, Optional.empty());
    }

    public static AuthenticationResult withSession(AuthenticatedUser user, String sessionToken) {
        return new AuthenticationResult(user, Optional.of(sessionToken));
    }
}
