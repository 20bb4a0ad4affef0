package com.tau.backend.global.security;

import com.tau.backend.global.error.ProblemException;
import com.tau.backend.modules.auth.application.AuthErrorCode;
import com.tau.backend.modules.auth.application.AuthException;
import com.tau.backend.modules.auth.domain.AuthenticatedUser;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser user)) {
            throw new AuthException(AuthErrorCode.NO_CREDENTIALS);
        }
        return user;
    }

    public static AuthenticatedUser requireInfrastructureAdmin() {
        AuthenticatedUser user = getCurrentUser();
        if (!user.infrastructureAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "INSUFFICIENT_PERMISSIONS",
                    "Only the infrastructure administrator may perform this operation.");
        }
        return user;
    }
}
