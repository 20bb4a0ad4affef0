package com.tau.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.tau.backend.global.error.ProblemException;
import com.tau.backend.modules.auth.domain.AuthenticatedUser;
import com.tau.backend.modules.auth.domain.Permission;
import com.tau.backend.modules.auth.domain.Role;
import com.tau.backend.modules.auth.domain.TournamentUser;
import com.tau.backend.modules.auth.domain.User;
import com.tau.backend.modules.auth.infrastructure.persistence.TournamentRoleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class TournamentAuthorizationServiceTest {

    private static final UUID TOURNAMENT_ID = UUID.fromString("11111111-2222-3333-4444-555555555555");

    @Mock
    private TournamentRoleRepository tournamentRoleRepository;

    private TournamentAuthorizationService service;
    private AuthenticatedUser judge;

    @BeforeEach
    void setUp() {
        service = new TournamentAuthorizationService(tournamentRoleRepository);
        judge = new AuthenticatedUser(UUID.randomUUID(), "judy", null, false);
    }

    @Test
    void loadCollectsRolesForTournament() {
        when(tournamentRoleRepository.findRoles(judge.id(), TOURNAMENT_ID)).thenReturn(List.of(Role.JUDGE));

        TournamentUser tournamentUser = service.load(judge, TOURNAMENT_ID);

        assertThat(tournamentUser.roles()).containsExactly(Role.JUDGE);
        assertThat(tournamentUser.tournamentId()).isEqualTo(TOURNAMENT_ID);
        assertThat(tournamentUser.hasPermission(Permission.READ_DEBATES)).isTrue();
    }

    @Test
    void userWithoutRolesCannotEvenRead() {
        when(tournamentRoleRepository.findRoles(judge.id(), TOURNAMENT_ID)).thenReturn(List.of());

        assertThatThrownBy(() -> service.requirePermission(judge, TOURNAMENT_ID, Permission.READ_TOURNAMENT))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getHttpStatus()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(problem.getCode()).isEqualTo("INSUFFICIENT_PERMISSIONS");
                });
    }

    @Test
    void judgeCannotWriteTeams() {
        when(tournamentRoleRepository.findRoles(judge.id(), TOURNAMENT_ID)).thenReturn(List.of(Role.JUDGE));

        assertThatThrownBy(() -> service.requirePermission(judge, TOURNAMENT_ID, Permission.WRITE_TEAMS))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    void infrastructureAdminPassesWithoutRoles() {
        AuthenticatedUser admin = new AuthenticatedUser(User.INFRASTRUCTURE_ADMIN_ID, "admin", null, true);
        when(tournamentRoleRepository.findRoles(admin.id(), TOURNAMENT_ID)).thenReturn(List.of());

        TournamentUser tournamentUser = service.requirePermission(admin, TOURNAMENT_ID, Permission.DELETE_USERS);

        assertThat(tournamentUser.roles()).isEmpty();
    }
}
