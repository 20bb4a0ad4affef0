package com.tau.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.tau.backend.modules.auth.domain.Permission;
import com.tau.backend.modules.auth.domain.Role;
import com.tau.backend.modules.auth.domain.TournamentUser;

public record TournamentPermissionsResponse(
        UUID tournamentId,
        UUID userId,
        List<Role> roles,
        List<Permission> permissions
) {

    public static TournamentPermissionsResponse from(TournamentUser tournamentUser) {
        return new TournamentPermissionsResponse(
                tournamentUser.tournamentId(),
                tournamentUser.user().id(),
                tournamentUser.roles().stream().sorted().toList(),
                tournamentUser.permissions().stream().sorted().toList()
        );
    }
}
