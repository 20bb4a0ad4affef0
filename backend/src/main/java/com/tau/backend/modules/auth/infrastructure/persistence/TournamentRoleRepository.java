package com.tau.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.tau.backend.modules.auth.domain.Role;
import com.tau.backend.modules.auth.domain.TournamentRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TournamentRoleRepository extends JpaRepository<TournamentRole, UUID> {

    @Query("""
            select distinct tr.role
              from TournamentRole tr
             where tr.user.id = :userId
               and tr.tournamentId = :tournamentId
            """)
    List<Role> findRoles(@Param("userId") UUID userId, @Param("tournamentId") UUID tournamentId);
}
