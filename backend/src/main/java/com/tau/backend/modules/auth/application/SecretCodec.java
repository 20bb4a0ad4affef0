package com.tau.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;

import org.springframework.stereotype.Component;

/**
 * Encodes raw secrets for transport and hashes presented tokens into their storage form.
 * <p>
 * The hash is plain SHA-256 on purpose: it is a lookup key, so it has to be deterministic,
 * and the tokens it protects already carry 256 random bits. Passwords go through
 * {@link PasswordHasher} instead.
 */
@Component
public class SecretCodec {

    private static final Base64.Encoder URL_SAFE_ENCODER = Base64.getUrlEncoder().withoutPadding();

    public String encode(byte[] secret) {
        return URL_SAFE_ENCODER.encodeToString(secret);
    }

    public String hashToken(String token) {
        Objects.requireNonNull(token, "token");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
