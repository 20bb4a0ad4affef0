package com.tau.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Authentication failure kinds. Header-shape problems are 400s with a precise message;
 * identity problems are 401s that never say whether a handle exists.
 */
public enum AuthErrorCode {
    NO_CREDENTIALS(HttpStatus.UNAUTHORIZED, "No authentication credentials provided."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid credentials."),
    SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "Session expired."),
    SESSION_NOT_FOUND(HttpStatus.UNAUTHORIZED, "Session not found."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid token."),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Provided single-use login token has expired."),
    TOKEN_ALREADY_USED(HttpStatus.UNAUTHORIZED, "Provided single-use login token has already been used."),

    NON_ASCII_HEADER_CHARACTERS(HttpStatus.BAD_REQUEST, "Non-ASCII characters found in Authorization header."),
    BAD_HEADER_AUTH_SCHEME_DATA(HttpStatus.BAD_REQUEST, "Could not parse header auth scheme/data."),
    UNSUPPORTED_HEADER_AUTH_SCHEME(HttpStatus.BAD_REQUEST, "Unsupported header auth scheme - use Basic or Bearer."),
    MALFORMED_BASIC_CREDENTIALS(HttpStatus.BAD_REQUEST, "Basic credentials must be Base64-encoded UTF-8."),
    NO_BASIC_AUTH_COLON_SPLIT(HttpStatus.BAD_REQUEST, "Basic credentials are missing a colon between login and password."),
    CLEAR_SESSION_BEARER_ONLY(HttpStatus.BAD_REQUEST, "Can only clear a session given in the Bearer scheme."),
    TOO_MANY_SESSION_TOKENS(HttpStatus.BAD_REQUEST, "Please provide one session token to destroy at a time."),
    NO_SESSION_TOKEN(HttpStatus.BAD_REQUEST, "Please provide a session token to destroy.");

    private final HttpStatus status;
    private final String detail;

    AuthErrorCode(HttpStatus status, String detail) {
        this.status = status;
        this.detail = detail;
    }

    public HttpStatus status() {
        return status;
    }

    public String detail() {
        return detail;
    }
}
