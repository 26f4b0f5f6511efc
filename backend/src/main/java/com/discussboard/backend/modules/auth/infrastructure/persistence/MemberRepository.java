package com.discussboard.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.auth.domain.Member;
import com.discussboard.backend.modules.auth.domain.MemberStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

    @Query("select m from Member m where m.id = :id and m.deletedAt is null")
    Optional<Member> findActiveById(@Param("id") UUID id);

    @Query("select m from Member m where m.userAccount.id = :userAccountId and m.deletedAt is null")
    Optional<Member> findActiveByUserAccountId(@Param("userAccountId") UUID userAccountId);

    @Query("select count(m) > 0 from Member m where m.nickname = :nickname and m.deletedAt is null")
    boolean existsActiveByNickname(@Param("nickname") String nickname);

    @Query("""
            select count(m) > 0
              from Member m
             where m.nickname = :nickname
               and m.id <> :excludedId
               and m.deletedAt is null
            """)
    boolean existsActiveByNicknameExcluding(@Param("nickname") String nickname, @Param("excludedId") UUID excludedId);

    @Query("select count(m) > 0 from Member m where m.userAccount.id = :userAccountId and m.deletedAt is null")
    boolean existsActiveByUserAccountId(@Param("userAccountId") UUID userAccountId);

    @Query(value = """
            select m
              from Member m
             where m.deletedAt is null
               and (:nicknamePattern is null or lower(m.nickname) like :nicknamePattern escape '\\')
               and (:status is null or m.status = :status)
               and (:createdFrom is null or m.createdAt >= :createdFrom)
               and (:createdTo is null or m.createdAt <= :createdTo)
            """,
            countQuery = """
            select count(m)
              from Member m
             where m.deletedAt is null
               and (:nicknamePattern is null or lower(m.nickname) like :nicknamePattern escape '\\')
               and (:status is null or m.status = :status)
               and (:createdFrom is null or m.createdAt >= :createdFrom)
               and (:createdTo is null or m.createdAt <= :createdTo)
            """)
    Page<Member> search(
            @Param("nicknamePattern") String nicknamePattern,
            @Param("status") MemberStatus status,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            Pageable pageable
    );
}
