package com.tau.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.tau.backend.global.error.ProblemException;
import com.tau.backend.modules.auth.domain.AuthenticatedUser;
import com.tau.backend.modules.auth.domain.PhotoUrl;
import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.infrastructure.persistence.LoginTokenRepository;
import com.tau.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final UserRepository userRepository;
    private final LoginTokenRepository loginTokenRepository;
    private final SessionService sessionService;
    private final PasswordHasher passwordHasher;
    private final AuthenticationService authenticationService;

    public UserAccountService(
            UserRepository userRepository,
            LoginTokenRepository loginTokenRepository,
            SessionService sessionService,
            PasswordHasher passwordHasher,
            AuthenticationService authenticationService
    ) {
        this.userRepository = userRepository;
        this.loginTokenRepository = loginTokenRepository;
        this.sessionService = sessionService;
        this.passwordHasher = passwordHasher;
        this.authenticationService = authenticationService;
    }

    @Transactional(readOnly = true)
    public User getById(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public List<User> listAll() {
        return userRepository.findAllOrderByHandle();
    }

    /**
     * Removes a user together with their sessions and login tokens. Rows elsewhere that still
     * reference the user (tournament roles) make the delete fail with {@code 409}; the whole
     * deletion is rolled back in that case.
     */
    @Transactional
    public void delete(UUID userId) {
        if (User.INFRASTRUCTURE_ADMIN_ID.equals(userId)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "INSUFFICIENT_PERMISSIONS",
                    "The infrastructure administrator cannot be deleted.");
        }
        User user = getById(userId);

        int sessions = sessionService.destroyAllForUser(userId);
        loginTokenRepository.deleteAllByUserId(userId);
        try {
            userRepository.delete(user);
            userRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "DEPENDENT_RESOURCES",
                    "Other resources still reference this user.", ex);
        }
        log.info("Deleted user {} and {} session(s)", userId, sessions);
    }

    /**
     * Applies a partial update to a user. Only the user themself or the infrastructure
     * administrator may do this; {@code null} arguments leave the field unchanged. A new
     * password invalidates every session of the target user.
     */
    @Transactional
    public User update(AuthenticatedUser caller, UUID userId, String handle, PhotoUrl profilePicture, String password) {
        if (!caller.infrastructureAdmin() && !caller.id().equals(userId)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "INSUFFICIENT_PERMISSIONS",
                    "You are not permitted to modify this user.");
        }
        User user = getById(userId);

        if (handle != null && !handle.equals(user.getHandle())) {
            boolean taken = userRepository.findByHandle(handle)
                    .filter(other -> !other.getId().equals(userId))
                    .isPresent();
            if (taken) {
                throw handleTaken(null);
            }
            user.setHandle(handle);
        }
        if (profilePicture != null) {
            user.setProfilePicture(profilePicture);
        }
        if (password != null) {
            user.setPasswordHash(passwordHasher.hash(password));
        }

        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw handleTaken(ex);
        }

        if (password != null) {
            int invalidated = sessionService.destroyAllForUser(userId);
            log.info("User {} updated by {}, password replaced, {} session(s) invalidated", userId, caller.id(), invalidated);
        } else {
            log.info("User {} updated by {}", userId, caller.id());
        }
        return user;
    }

    private static ProblemException handleTaken(Throwable cause) {
        return new ProblemException(HttpStatus.CONFLICT, "HANDLE_TAKEN", "A user with this handle already exists.", cause);
    }

    /**
     * Verifies the current password, stores the new hash and replaces every existing session
     * of the user with a single fresh one.
     */
    public IssuedSession changePassword(UUID userId, String currentPassword, String newPassword) {
        User user = getById(userId);
        authenticationService.authenticateWithPassword(user.getHandle(), currentPassword);

        user.setPasswordHash(passwordHasher.hash(newPassword));
        userRepository.save(user);

        int invalidated = sessionService.destroyAllForUser(userId);
        log.info("Password changed for user {}, {} session(s) invalidated", userId, invalidated);
        return sessionService.create(user);
    }
}
