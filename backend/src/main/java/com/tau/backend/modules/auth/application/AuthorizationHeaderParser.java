package com.tau.backend.modules.auth.application;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

public final class AuthorizationHeaderParser {

    private static final String BASIC_SCHEME = "Basic";
    private static final String BEARER_SCHEME = "Bearer";

    private AuthorizationHeaderParser() {
    }

    /**
     * Rejects anything outside visible ASCII and horizontal tab.
     */
    public static void requireVisibleAscii(String header) {
        for (int i = 0; i < header.length(); i++) {
            char c = header.charAt(i);
            if (c != '\t' && (c < 0x20 || c > 0x7E)) {
                throw new AuthException(AuthErrorCode.NON_ASCII_HEADER_CHARACTERS);
            }
        }
    }

    /**
     * Splits the header on its first space into scheme and data. Basic data is decoded
     * here, so a returned {@link AuthorizationCredentials.Basic} is always well formed.
     */
    public static AuthorizationCredentials parse(String header) {
        requireVisibleAscii(header);
        int space = header.indexOf(' ');
        if (space < 0) {
            throw new AuthException(AuthErrorCode.BAD_HEADER_AUTH_SCHEME_DATA);
        }
        String scheme = header.substring(0, space);
        String data = header.substring(space + 1);

        return switch (scheme) {
            case BASIC_SCHEME -> decodeBasic(data);
            case BEARER_SCHEME -> new AuthorizationCredentials.Bearer(data);
            default -> new AuthorizationCredentials.Unrecognized(scheme);
        };
    }

    private static AuthorizationCredentials.Basic decodeBasic(String data) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException ex) {
            throw new AuthException(AuthErrorCode.MALFORMED_BASIC_CREDENTIALS, ex);
        }

        String credentials;
        try {
            credentials = StandardCharsets.UTF_8.newDecoder()
                    .decode(ByteBuffer.wrap(decoded))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new AuthException(AuthErrorCode.MALFORMED_BASIC_CREDENTIALS, ex);
        }

        int colon = credentials.indexOf(':');
        if (colon < 0) {
            throw new AuthException(AuthErrorCode.NO_BASIC_AUTH_COLON_SPLIT);
        }
        return new AuthorizationCredentials.Basic(credentials.substring(0, colon), credentials.substring(colon + 1));
    }
}
