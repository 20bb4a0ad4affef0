package com.tau.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required configuration is missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "tau.auth.secret",
            "tau.infradmin.password"
    };

    private static final String[] DURATION_KEYS = {
            "tau.auth.session-lifetime",
            "tau.auth.login-link-lifetime"
    };

    private static final int MIN_SECRET_LENGTH = 16;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @Order(0)
    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = Optional.ofNullable(environment.getProperty(key)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                missing.add(key);
            }
        }

        Optional.ofNullable(environment.getProperty("tau.auth.secret"))
                .map(String::trim)
                .filter(secret -> !secret.isEmpty() && secret.length() < MIN_SECRET_LENGTH)
                .ifPresent(secret -> invalid.add("tau.auth.secret: must be at least " + MIN_SECRET_LENGTH + " characters"));

        for (String key : DURATION_KEYS) {
            String value = environment.getProperty(key);
            if (value == null) {
                continue;
            }
            try {
                Duration duration = Duration.parse(value.trim());
                if (duration.isZero() || duration.isNegative()) {
                    invalid.add(key + ": must be positive");
                }
            } catch (DateTimeParseException e) {
                invalid.add(key + ": must be an ISO-8601 duration such as P7D");
            }
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            StringBuilder message = new StringBuilder("Environment validation failed.");
            if (!missing.isEmpty()) {
                message.append(" Missing: ").append(String.join(", ", missing)).append('.');
            }
            if (!invalid.isEmpty()) {
                message.append(" Invalid: ").append(String.join("; ", invalid)).append('.');
            }
            log.error(message.toString());
            throw new IllegalStateException(message.toString());
        }

        log.info("Environment validation passed");
    }
}
