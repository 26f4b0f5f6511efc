package com.discussboard.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Query("select ua from UserAccount ua where lower(ua.email) = lower(:email) and ua.deletedAt is null")
    Optional<UserAccount> findActiveByEmail(@Param("email") String email);

    @Query("select count(ua) > 0 from UserAccount ua where lower(ua.email) = lower(:email) and ua.deletedAt is null")
    boolean existsActiveByEmail(@Param("email") String email);

    @Query("select ua from UserAccount ua where ua.id = :id and ua.deletedAt is null")
    Optional<UserAccount> findActiveById(@Param("id") UUID id);
}
