package com.discussboard.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.auth.domain.JwtSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JwtSessionRepository extends JpaRepository<JwtSession, UUID> {

    @Query("select s from JwtSession s join fetch s.userAccount where s.refreshTokenHash = :refreshTokenHash")
    Optional<JwtSession> findByRefreshTokenHash(@Param("refreshTokenHash") String refreshTokenHash);

    @Modifying
    @Query("""
            update JwtSession s
               set s.revokedAt = :revokedAt,
                   s.revokedReason = :reason
             where s.refreshTokenHash = :refreshTokenHash
               and s.revokedAt is null
            """)
    int revokeByRefreshTokenHash(@Param("refreshTokenHash") String refreshTokenHash,
                                 @Param("revokedAt") OffsetDateTime revokedAt,
                                 @Param("reason") String reason);

    @Modifying
    @Query("""
            update JwtSession s
               set s.revokedAt = :now,
                   s.revokedReason = :reason
             where s.userAccount.id = :userAccountId
               and s.revokedAt is null
               and s.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("userAccountId") UUID userAccountId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") String reason);
}
