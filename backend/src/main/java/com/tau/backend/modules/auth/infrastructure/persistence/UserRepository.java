package com.tau.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tau.backend.modules.auth.domain.User;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, UUID> {

    @Query("select u from User u where u.handle = :handle")
    Optional<User> findByHandle(@Param("handle") String handle);

    @Query("select u from User u order by lower(u.handle)")
    List<User> findAllOrderByHandle();
}
