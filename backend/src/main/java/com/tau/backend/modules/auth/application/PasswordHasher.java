package com.tau.backend.modules.auth.application;

import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted, memory-hard password hashing backed by the Argon2 {@link PasswordEncoder}.
 * Stored values are self-describing ({@code $argon2id$v=19$m=...,t=...,p=...$salt$digest}),
 * so verification re-derives with the embedded parameters.
 */
@Component
public class PasswordHasher {

    private static final Pattern ARGON2_ENCODING = Pattern.compile("^\\$argon2(id|i|d)\\$\\S+$");

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String password) {
        try {
            return passwordEncoder.encode(password);
        } catch (RuntimeException ex) {
            throw new PasswordHashException(PasswordHashException.Kind.HASHING, "Password hashing failed", ex);
        }
    }

    public boolean verify(String password, String storedHash) {
        if (storedHash == null || !ARGON2_ENCODING.matcher(storedHash).matches()) {
            throw new PasswordHashException(PasswordHashException.Kind.FORMAT, "Stored password hash is not an Argon2 encoding");
        }
        return passwordEncoder.matches(password, storedHash);
    }
}
