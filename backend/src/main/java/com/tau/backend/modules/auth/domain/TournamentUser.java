package com.tau.backend.modules.auth.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * An authenticated user together with the roles they hold in one tournament.
 */
public record TournamentUser(AuthenticatedUser user, UUID tournamentId, Set<Role> roles) {

    public TournamentUser {
        roles = roles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    /**
     * The infrastructure administrator holds every permission; everyone else holds
     * exactly the union of their roles' permissions, which is empty without roles.
     */
    public boolean hasPermission(Permission permission) {
        if (user.infrastructureAdmin()) {
            return true;
        }
        return roles.stream().anyMatch(role -> role.grants(permission));
    }

    public Set<Permission> permissions() {
        if (user.infrastructureAdmin()) {
            return Collections.unmodifiableSet(EnumSet.allOf(Permission.class));
        }
        EnumSet<Permission> granted = EnumSet.noneOf(Permission.class);
        roles.forEach(role -> granted.addAll(role.permissions()));
        return Collections.unmodifiableSet(granted);
    }
}
