package com.tau.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tau.backend.modules.auth.domain.LoginToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoginTokenRepository extends JpaRepository<LoginToken, UUID> {

    @Query("select lt from LoginToken lt join fetch lt.user where lt.tokenHash = :tokenHash")
    Optional<LoginToken> findByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Returns 1 for the single caller that flipped the flag and 0 for everyone who lost
     * the race; the row lock taken by the update serialises concurrent redeemers.
     */
    @Modifying
    @Query("update LoginToken lt set lt.used = true where lt.id = :id and lt.used = false")
    int markUsed(@Param("id") UUID id);

    @Modifying
    @Query("delete from LoginToken lt where lt.user.id = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);
}
