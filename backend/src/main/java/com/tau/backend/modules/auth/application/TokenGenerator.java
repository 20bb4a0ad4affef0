package com.tau.backend.modules.auth.application;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Produces opaque bearer tokens for sessions and login links.
 * <p>
 * 32 bytes come from {@link SecureRandom}; the deployment secret and the current epoch
 * second are XOR-folded over them afterwards. Neither fold can remove entropy from the
 * random bytes, and the secret alone never determines a token.
 */
@Component
public class TokenGenerator {

    static final int TOKEN_BYTES = 32;

    private final SecretCodec secretCodec;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final byte[] deploymentSecret;

    public TokenGenerator(
            SecretCodec secretCodec,
            SecureRandom secureRandom,
            Clock clock,
            @Value("${tau.auth.secret:}") String deploymentSecret
    ) {
        this.secretCodec = secretCodec;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.deploymentSecret = deploymentSecret == null
                ? new byte[0]
                : deploymentSecret.getBytes(StandardCharsets.UTF_8);
    }

    public String generateToken() {
        byte[] token = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(token);

        for (int i = 0; i < deploymentSecret.length; i++) {
            token[i % token.length] ^= deploymentSecret[i];
        }

        byte[] timestamp = ByteBuffer.allocate(Long.BYTES)
                .putLong(clock.instant().getEpochSecond())
                .array();
        for (int i = 0; i < token.length; i++) {
            token[i] ^= timestamp[i % timestamp.length];
        }

        return secretCodec.encode(token);
    }
}
