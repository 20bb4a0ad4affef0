package com.tau.backend.modules.auth.presentation;

import java.util.List;

import com.tau.backend.modules.auth.application.SessionService;
import com.tau.backend.modules.auth.application.UserAccountService;
import com.tau.backend.modules.auth.presentation.dto.SessionResponse;
import com.tau.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Access is restricted to the infrastructure administrator in {@code SecurityConfig}.
 */
@RestController
@RequestMapping("/infradmin")
public class InfrastructureAdminController {

    private final UserAccountService userAccountService;
    private final SessionService sessionService;

    public InfrastructureAdminController(UserAccountService userAccountService, SessionService sessionService) {
        this.userAccountService = userAccountService;
        this.sessionService = sessionService;
    }

    @Operation(summary = "List all users")
    @GetMapping("/all-users")
    public ResponseEntity<List<UserResponse>> allUsers() {
        return ResponseEntity.ok(userAccountService.listAll().stream().map(UserResponse::from).toList());
    }

    @Operation(summary = "List all sessions")
    @GetMapping("/sessions")
    public ResponseEntity<List<SessionResponse>> sessions() {
        return ResponseEntity.ok(sessionService.listAll().stream().map(SessionResponse::from).toList());
    }
}
