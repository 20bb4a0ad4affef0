package com.tau.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

import org.junit.jupiter.api.Test;

class SecretCodecTest {

    private final SecretCodec secretCodec = new SecretCodec();

    @Test
    void hashIsLowercaseHexSha256() throws Exception {
        String expected = HexFormat.of().formatHex(
                MessageDigest.getInstance("SHA-256").digest("some-token".getBytes(StandardCharsets.UTF_8)));

        assertThat(secretCodec.hashToken("some-token"))
                .isEqualTo(expected)
                .hasSize(64)
                .matches("[0-9a-f]{64}");
    }

    @Test
    void hashIsDeterministicAndDistinguishesTokens() {
        assertThat(secretCodec.hashToken("abc")).isEqualTo(secretCodec.hashToken("abc"));
        assertThat(secretCodec.hashToken("abc")).isNotEqualTo(secretCodec.hashToken("abd"));
    }

    @Test
    void encodeIsUrlSafeWithoutPadding() {
        byte[] bytes = {(byte) 0xfb, (byte) 0xff, (byte) 0xfe, 0x01};

        assertThat(secretCodec.encode(bytes)).isEqualTo("-__-AQ");
    }
}
