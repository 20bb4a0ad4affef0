package com.tau.backend.modules.auth.domain;

/**
 * Atomic capabilities checked by the resource layer. Never granted to a user directly,
 * only through a {@link Role} held in a tournament.
 */
public enum Permission {
    CREATE_USERS_MANUALLY,
    CREATE_USERS_WITH_LINK,
    DELETE_USERS,
    MODIFY_USER_ROLES,

    READ_AFFILIATIONS,
    WRITE_AFFILIATIONS,
    READ_ATTENDEES,
    WRITE_ATTENDEES,
    READ_DEBATES,
    WRITE_DEBATES,
    READ_LOCATIONS,
    WRITE_LOCATIONS,
    READ_PHASES,
    WRITE_PHASES,
    READ_ROOMS,
    WRITE_ROOMS,
    MODIFY_ALL_ROOM_DETAILS,
    READ_ROUNDS,
    WRITE_ROUNDS,
    READ_TEAMS,
    WRITE_TEAMS,
    READ_TOURNAMENT,
    WRITE_TOURNAMENT,
    WRITE_ROLES,

    SUBMIT_OWN_VERDICT_VOTE,
    SUBMIT_VERDICT
}
