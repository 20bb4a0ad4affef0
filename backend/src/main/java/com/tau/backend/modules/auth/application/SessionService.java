package com.tau.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tau.backend.global.error.ProblemException;
import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.domain.UserSession;
import com.tau.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class SessionService {

    private final UserSessionRepository userSessionRepository;
    private final TokenGenerator tokenGenerator;
    private final SecretCodec secretCodec;
    private final Clock clock;
    private final Duration sessionLifetime;

    public SessionService(
            UserSessionRepository userSessionRepository,
            TokenGenerator tokenGenerator,
            SecretCodec secretCodec,
            Clock clock,
            @Value("${tau.auth.session-lifetime:P7D}") Duration sessionLifetime
    ) {
        this.userSessionRepository = userSessionRepository;
        this.tokenGenerator = tokenGenerator;
        this.secretCodec = secretCodec;
        this.clock = clock;
        this.sessionLifetime = sessionLifetime;
    }

    public IssuedSession create(User user) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String rawToken = tokenGenerator.generateToken();

        UserSession session = new UserSession();
        session.setUser(user);
        session.setTokenHash(secretCodec.hashToken(rawToken));
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(sessionLifetime));

        return new IssuedSession(userSessionRepository.save(session), rawToken);
    }

    /**
     * Resolves a presented raw token. Expired sessions are reported but left in place;
     * removing them is the job of logout or user deletion.
     */
    @Transactional(readOnly = true, noRollbackFor = ResponseStatusException.class)
    public UserSession fetchByToken(String rawToken) {
        UserSession session = findByToken(rawToken)
                .orElseThrow(() -> new AuthException(AuthErrorCode.SESSION_NOT_FOUND));
        if (session.isExpired(OffsetDateTime.now(clock))) {
            throw new AuthException(AuthErrorCode.SESSION_EXPIRED);
        }
        return session;
    }

    /**
     * Lookup without the expiry check.
     */
    @Transactional(readOnly = true)
    public Optional<UserSession> findByToken(String rawToken) {
        return userSessionRepository.findByTokenHash(secretCodec.hashToken(rawToken));
    }

    @Transactional(readOnly = true, noRollbackFor = ResponseStatusException.class)
    public UserSession fetchById(UUID sessionId) {
        return userSessionRepository.findById(sessionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND"));
    }

    /**
     * Sliding expiry: every successful use pushes the expiry a full lifetime past now.
     */
    public UserSession prolongAndTouch(UserSession session) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        session.setExpiresAt(now.plus(sessionLifetime));
        session.setLastAccessAt(now);
        return userSessionRepository.save(session);
    }

    public void destroy(UserSession session) {
        userSessionRepository.delete(session);
    }

    public int destroyAllForUser(UUID userId) {
        return userSessionRepository.deleteAllByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<UserSession> listAll() {
        return userSessionRepository.findAllWithUser();
    }
}
