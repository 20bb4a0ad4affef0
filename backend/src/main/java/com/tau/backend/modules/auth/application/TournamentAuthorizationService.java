package com.tau.backend.modules.auth.application;

import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import com.tau.backend.global.error.ProblemException;
import com.tau.backend.modules.auth.domain.AuthenticatedUser;
import com.tau.backend.modules.auth.domain.Permission;
import com.tau.backend.modules.auth.domain.Role;
import com.tau.backend.modules.auth.domain.TournamentUser;
import com.tau.backend.modules.auth.infrastructure.persistence.TournamentRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for resource handlers that need a tournament-scoped permission check.
 */
@Service
@Transactional(readOnly = true)
public class TournamentAuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(TournamentAuthorizationService.class);

    private final TournamentRoleRepository tournamentRoleRepository;

    public TournamentAuthorizationService(TournamentRoleRepository tournamentRoleRepository) {
        this.tournamentRoleRepository = tournamentRoleRepository;
    }

    public TournamentUser load(AuthenticatedUser user, UUID tournamentId) {
        List<Role> roles = tournamentRoleRepository.findRoles(user.id(), tournamentId);
        return new TournamentUser(
                user,
                tournamentId,
                roles.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(roles)
        );
    }

    public TournamentUser requirePermission(AuthenticatedUser user, UUID tournamentId, Permission permission) {
        TournamentUser tournamentUser = load(user, tournamentId);
        if (!tournamentUser.hasPermission(permission)) {
            log.info("User {} lacks {} in tournament {}", user.id(), permission, tournamentId);
            throw new ProblemException(HttpStatus.FORBIDDEN, "INSUFFICIENT_PERMISSIONS",
                    "You are not permitted to perform this operation.");
        }
        return tournamentUser;
    }
}
