package com.tau.backend.modules.auth.application;

/**
 * Internal password-hashing failure. Never shown to clients in any detail.
 */
public class PasswordHashException extends RuntimeException {

    public enum Kind {
        /** The encoder itself failed while deriving a hash. */
        HASHING,
        /** A stored hash is not a recognisable Argon2 encoding. */
        FORMAT
    }

    private final Kind kind;

    public PasswordHashException(Kind kind, String message) {
        this(kind, message, null);
    }

    public PasswordHashException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
