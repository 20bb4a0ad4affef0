package com.tau.backend.modules.auth.presentation;

import java.util.UUID;

import com.tau.backend.global.security.SecurityUtils;
import com.tau.backend.global.security.SessionCookieFactory;
import com.tau.backend.modules.auth.application.IssuedLoginLink;
import com.tau.backend.modules.auth.application.IssuedSession;
import com.tau.backend.modules.auth.application.LoginLinkService;
import com.tau.backend.modules.auth.application.UserAccountService;
import com.tau.backend.modules.auth.domain.AuthenticatedUser;
import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tau.backend.modules.auth.presentation.dto.LoginLinkResponse;
import com.tau.backend.modules.auth.presentation.dto.SessionTokenResponse;
import com.tau.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.tau.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserAccountService userAccountService;
    private final LoginLinkService loginLinkService;
    private final SessionCookieFactory sessionCookieFactory;

    public UserController(
            UserAccountService userAccountService,
            LoginLinkService loginLinkService,
            SessionCookieFactory sessionCookieFactory
    ) {
        this.userAccountService = userAccountService;
        this.loginLinkService = loginLinkService;
        this.sessionCookieFactory = sessionCookieFactory;
    }

    @Operation(summary = "Current user")
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(UserResponse.fromPrincipal(user));
    }

    @Operation(summary = "Change password", description = "Invalidates every session of the user and opens a new one.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "401", description = "Current password is wrong")
    })
    @PutMapping("/me/password")
    public ResponseEntity<SessionTokenResponse> changePassword(
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletResponse response
    ) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        IssuedSession issued = userAccountService.changePassword(user.id(), request.currentPassword(), request.newPassword());
        // replaces the renewal cookie the authentication filter set for the now destroyed session
        response.setHeader(HttpHeaders.SET_COOKIE, sessionCookieFactory.sessionCookie(issued.rawToken()).toString());
        return ResponseEntity.ok(SessionTokenResponse.from(issued));
    }

    @Operation(summary = "Update a user", description = "The user themself or the infrastructure administrator. "
            + "A new password logs the user out of every session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User updated"),
            @ApiResponse(responseCode = "400", description = "Invalid handle, picture link or password"),
            @ApiResponse(responseCode = "403", description = "Caller may not modify this user"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "Handle already taken")
    })
    @PatchMapping("/{userId}")
    public ResponseEntity<UserResponse> update(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserRequest request,
            HttpServletResponse response
    ) {
        AuthenticatedUser caller = SecurityUtils.getCurrentUser();
        User user = userAccountService.update(
                caller, userId, request.handle(), request.profilePicture(), request.password());
        if (request.password() != null && caller.id().equals(userId)) {
            response.setHeader(HttpHeaders.SET_COOKIE, sessionCookieFactory.clearedCookie().toString());
        }
        return ResponseEntity.ok(UserResponse.from(user));
    }

    @Operation(summary = "Delete a user", description = "Infrastructure administrator only.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "User deleted"),
            @ApiResponse(responseCode = "403", description = "Caller is not the infrastructure administrator, or target is"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "User is still referenced by other resources")
    })
    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> delete(@PathVariable("userId") UUID userId) {
        SecurityUtils.requireInfrastructureAdmin();
        userAccountService.delete(userId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Issue a login link", description = "Infrastructure administrator only.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Link issued"),
            @ApiResponse(responseCode = "403", description = "Caller is not the infrastructure administrator"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PostMapping("/{userId}/login-link")
    public ResponseEntity<LoginLinkResponse> issueLoginLink(@PathVariable("userId") UUID userId) {
        SecurityUtils.requireInfrastructureAdmin();
        IssuedLoginLink link = loginLinkService.issue(userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new LoginLinkResponse(link.path(), link.token().getExpiresAt()));
    }
}
