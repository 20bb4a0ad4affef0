package com.tau.backend.modules.auth.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Roles a user can hold within one tournament. A new user holds none, and several
 * users may hold the same role.
 */
public enum Role {
    /** Every permission within the tournament. */
    ORGANIZER,
    /** Reads tournament data and submits verdicts for debates the judge is assigned to. */
    JUDGE,
    /** Conducts debates; may submit verdicts on the judges' behalf. */
    MARSHALL;

    public Set<Permission> permissions() {
        EnumSet<Permission> granted = switch (this) {
            case ORGANIZER -> EnumSet.allOf(Permission.class);
            case JUDGE -> EnumSet.of(
                    Permission.READ_ATTENDEES,
                    Permission.READ_DEBATES,
                    Permission.READ_TEAMS,
                    Permission.READ_TOURNAMENT,
                    Permission.SUBMIT_OWN_VERDICT_VOTE
            );
            case MARSHALL -> EnumSet.of(
                    Permission.READ_ATTENDEES,
                    Permission.READ_DEBATES,
                    Permission.READ_TEAMS,
                    Permission.READ_TOURNAMENT,
                    Permission.SUBMIT_VERDICT
            );
        };
        return Collections.unmodifiableSet(granted);
    }

    public boolean grants(Permission permission) {
        return permissions().contains(permission);
    }
}
