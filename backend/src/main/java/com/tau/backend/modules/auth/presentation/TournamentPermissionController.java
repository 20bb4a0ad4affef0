package com.tau.backend.modules.auth.presentation;

import java.util.UUID;

import com.tau.backend.global.security.SecurityUtils;
import com.tau.backend.modules.auth.application.TournamentAuthorizationService;
import com.tau.backend.modules.auth.presentation.dto.TournamentPermissionsResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TournamentPermissionController {

    private final TournamentAuthorizationService tournamentAuthorizationService;

    public TournamentPermissionController(TournamentAuthorizationService tournamentAuthorizationService) {
        this.tournamentAuthorizationService = tournamentAuthorizationService;
    }

    @Operation(summary = "Caller's roles and effective permissions in a tournament")
    @GetMapping("/tournaments/{tournamentId}/permissions")
    public ResponseEntity<TournamentPermissionsResponse> permissions(@PathVariable("tournamentId") UUID tournamentId) {
        return ResponseEntity.ok(TournamentPermissionsResponse.from(
                tournamentAuthorizationService.load(SecurityUtils.getCurrentUser(), tournamentId)));
    }
}
