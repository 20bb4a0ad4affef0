package com.tau.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tau.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("select us from UserSession us join fetch us.user where us.tokenHash = :tokenHash")
    Optional<UserSession> findByTokenHash(@Param("tokenHash") String tokenHash);

    @Query("select us from UserSession us join fetch us.user order by us.issuedAt")
    List<UserSession> findAllWithUser();

    @Modifying
    @Query("delete from UserSession us where us.user.id = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);
}
