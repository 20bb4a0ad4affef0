package com.tau.backend.modules.auth.application;

import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Makes sure the infrastructure administrator exists once the application is up. An existing
 * admin row is left untouched, so a changed password survives restarts.
 */
@Component
public class InfrastructureAdminInitializer {

    private static final Logger log = LoggerFactory.getLogger(InfrastructureAdminInitializer.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final String initialPassword;

    public InfrastructureAdminInitializer(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            @Value("${tau.infradmin.password:}") String initialPassword
    ) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.initialPassword = initialPassword;
    }

    @Order(1)
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureInfrastructureAdmin() {
        if (userRepository.existsById(User.INFRASTRUCTURE_ADMIN_ID)) {
            log.debug("Infrastructure administrator already present");
            return;
        }
        if (initialPassword == null || initialPassword.isBlank()) {
            throw new IllegalStateException("tau.infradmin.password must be set to create the infrastructure administrator");
        }
        userRepository.save(User.infrastructureAdmin(passwordHasher.hash(initialPassword)));
        log.info("Created infrastructure administrator '{}'", User.INFRASTRUCTURE_ADMIN_HANDLE);
    }
}
