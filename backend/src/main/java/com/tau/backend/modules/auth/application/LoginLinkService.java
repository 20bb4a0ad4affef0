package com.tau.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.tau.backend.global.error.ProblemException;
import com.tau.backend.modules.auth.domain.LoginToken;
import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.infrastructure.persistence.LoginTokenRepository;
import com.tau.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Issues and redeems single-use login links. Redemption failures never name the user
 * the link was issued for.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class LoginLinkService {

    static final String LOGIN_PATH_PREFIX = "/auth/login/";

    private static final Logger log = LoggerFactory.getLogger(LoginLinkService.class);

    private final LoginTokenRepository loginTokenRepository;
    private final UserRepository userRepository;
    private final SessionService sessionService;
    private final TokenGenerator tokenGenerator;
    private final SecretCodec secretCodec;
    private final Clock clock;
    private final Duration linkLifetime;

    public LoginLinkService(
            LoginTokenRepository loginTokenRepository,
            UserRepository userRepository,
            SessionService sessionService,
            TokenGenerator tokenGenerator,
            SecretCodec secretCodec,
            Clock clock,
            @Value("${tau.auth.login-link-lifetime:PT24H}") Duration linkLifetime
    ) {
        this.loginTokenRepository = loginTokenRepository;
        this.userRepository = userRepository;
        this.sessionService = sessionService;
        this.tokenGenerator = tokenGenerator;
        this.secretCodec = secretCodec;
        this.clock = clock;
        this.linkLifetime = linkLifetime;
    }

    public IssuedLoginLink issue(UUID userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));

        String rawToken = tokenGenerator.generateToken();
        LoginToken token = new LoginToken();
        token.setUser(user);
        token.setTokenHash(secretCodec.hashToken(rawToken));
        token.setExpiresAt(OffsetDateTime.now(clock).plus(linkLifetime));
        token.setUsed(false);

        LoginToken saved = loginTokenRepository.save(token);
        log.info("Issued login link for user {} valid until {}", userId, saved.getExpiresAt());
        return new IssuedLoginLink(saved, rawToken, LOGIN_PATH_PREFIX + rawToken);
    }

    /**
     * Consumes the link. Of any number of concurrent redemptions of the same token,
     * exactly one gets past {@link LoginTokenRepository#markUsed(UUID)}.
     */
    public User redeem(String rawToken) {
        LoginToken token = loginTokenRepository.findByTokenHash(secretCodec.hashToken(rawToken))
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_TOKEN));

        if (token.isExpired(OffsetDateTime.now(clock))) {
            throw new AuthException(AuthErrorCode.TOKEN_EXPIRED);
        }
        if (token.isUsed()) {
            throw new AuthException(AuthErrorCode.TOKEN_ALREADY_USED);
        }
        if (loginTokenRepository.markUsed(token.getId()) == 0) {
            log.warn("Login token {} was redeemed concurrently", token.getId());
            throw new AuthException(AuthErrorCode.TOKEN_ALREADY_USED);
        }
        return token.getUser();
    }

    public IssuedSession redeemForSession(String rawToken) {
        User user = redeem(rawToken);
        return sessionService.create(user);
    }
}
