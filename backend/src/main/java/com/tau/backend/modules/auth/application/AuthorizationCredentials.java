package com.tau.backend.modules.auth.application;

/**
 * Parsed form of an {@code Authorization} header, produced by {@link AuthorizationHeaderParser}.
 */
public interface AuthorizationCredentials {

    record Basic(String login, String password) implements AuthorizationCredentials {

        @Override
        public String toString() {
            return "Basic[login=" + login + ", password=****]";
        }
    }

    record Bearer(String token) implements AuthorizationCredentials {

        @Override
        public String toString() {
            return "Bearer[****]";
        }
    }

    record Unrecognized(String scheme) implements AuthorizationCredentials {
    }
}
