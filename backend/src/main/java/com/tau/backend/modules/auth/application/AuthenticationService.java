package com.tau.backend.modules.auth.application;

import com.tau.backend.modules.auth.domain.AuthenticatedUser;
import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.domain.UserSession;
import com.tau.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Resolves the caller's identity from an {@code Authorization} header and/or a session cookie.
 * <p>
 * The header wins when both are present. Header-shape problems are reported precisely;
 * an unknown handle, a wrong password and an unknown session token are all reported as
 * {@link AuthErrorCode#INVALID_CREDENTIALS}.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final SessionService sessionService;

    public AuthenticationService(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            SessionService sessionService
    ) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.sessionService = sessionService;
    }

    public AuthenticationResult authenticate(String authorizationHeader, String sessionCookie) {
        if (authorizationHeader != null) {
            AuthorizationHeaderParser.requireVisibleAscii(authorizationHeader);
        }
        String cookie = (sessionCookie == null || sessionCookie.isEmpty()) ? null : sessionCookie;

        if (authorizationHeader == null && cookie == null) {
            throw new AuthException(AuthErrorCode.NO_CREDENTIALS);
        }

        if (authorizationHeader != null) {
            AuthorizationCredentials credentials = AuthorizationHeaderParser.parse(authorizationHeader);
            if (credentials instanceof AuthorizationCredentials.Basic basic) {
                User user = authenticateWithPassword(basic.login(), basic.password());
                return AuthenticationResult.withoutSession(AuthenticatedUser.from(user));
            }
            if (credentials instanceof AuthorizationCredentials.Bearer bearer) {
                return authenticateWithSession(bearer.token());
            }
            AuthorizationCredentials.Unrecognized unrecognized = (AuthorizationCredentials.Unrecognized) credentials;
            log.info("Rejected Authorization header with unsupported scheme '{}'", unrecognized.scheme());
            throw new AuthException(AuthErrorCode.UNSUPPORTED_HEADER_AUTH_SCHEME);
        }

        return authenticateWithSession(cookie);
    }

    public User authenticateWithPassword(String login, String password) {
        User user = userRepository.findByHandle(login).orElse(null);
        if (user == null) {
            log.info("Password authentication failed: unknown handle");
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        boolean matches;
        try {
            matches = passwordHasher.verify(password, user.getPasswordHash());
        } catch (PasswordHashException ex) {
            log.error("Stored password hash for user {} could not be verified", user.getId(), ex);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, ex);
        }
        if (!matches) {
            log.info("Password authentication failed for user {}", user.getId());
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }
        return user;
    }

    public AuthenticationResult authenticateWithSession(String rawToken) {
        UserSession session;
        try {
            session = sessionService.fetchByToken(rawToken);
        } catch (AuthException ex) {
            if (ex.getErrorCode() == AuthErrorCode.SESSION_NOT_FOUND) {
                log.info("Session authentication failed: unknown token");
                throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, ex);
            }
            throw ex;
        }
        sessionService.prolongAndTouch(session);
        return AuthenticationResult.withSession(AuthenticatedUser.from(session.getUser()), rawToken);
    }

    /**
     * Password login that opens a new session.
     */
    public IssuedSession login(String login, String password) {
        User user = authenticateWithPassword(login, password);
        IssuedSession issued = sessionService.create(user);
        log.info("User {} logged in, session {}", user.getId(), issued.session().getId());
        return issued;
    }

    /**
     * Destroys the session named by a Bearer header or the session cookie. Expired sessions
     * can still be destroyed.
     */
    public void logout(String authorizationHeader, String sessionCookie) {
        String cookie = (sessionCookie == null || sessionCookie.isEmpty()) ? null : sessionCookie;
        String headerToken = null;
        if (authorizationHeader != null) {
            AuthorizationCredentials credentials = AuthorizationHeaderParser.parse(authorizationHeader);
            if (!(credentials instanceof AuthorizationCredentials.Bearer bearer)) {
                throw new AuthException(AuthErrorCode.CLEAR_SESSION_BEARER_ONLY);
            }
            headerToken = bearer.token();
        }

        String token;
        if (headerToken != null && cookie != null) {
            if (!headerToken.equals(cookie)) {
                throw new AuthException(AuthErrorCode.TOO_MANY_SESSION_TOKENS);
            }
            token = headerToken;
        } else if (headerToken != null) {
            token = headerToken;
        } else if (cookie != null) {
            token = cookie;
        } else {
            throw new AuthException(AuthErrorCode.NO_SESSION_TOKEN);
        }

        UserSession session = sessionService.findByToken(token)
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_CREDENTIALS));
        sessionService.destroy(session);
        log.info("Session {} destroyed on logout", session.getId());
    }
}
