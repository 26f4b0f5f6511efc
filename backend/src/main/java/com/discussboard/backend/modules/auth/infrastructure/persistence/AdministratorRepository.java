package com.discussboard.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.auth.domain.Administrator;
import com.discussboard.backend.modules.auth.domain.StaffStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdministratorRepository extends JpaRepository<Administrator, UUID> {

    @Query("select a from Administrator a join fetch a.member where a.id = :id and a.deletedAt is null")
    Optional<Administrator> findActiveById(@Param("id") UUID id);

    @Query("""
            select a
              from Administrator a
             where a.member.id = :memberId
               and a.deletedAt is null
               and a.revokedAt is null
               and a.status = com.discussboard.backend.modules.auth.domain.StaffStatus.ACTIVE
            """)
    Optional<Administrator> findCurrentByMemberId(@Param("memberId") UUID memberId);

    @Query(value = """
            select a
              from Administrator a
             where a.deletedAt is null
               and (:status is null or a.status = :status)
               and (:memberId is null or a.member.id = :memberId)
            """,
            countQuery = """
            select count(a)
              from Administrator a
             where a.deletedAt is null
               and (:status is null or a.status = :status)
               and (:memberId is null or a.member.id = :memberId)
            """)
    Page<Administrator> search(@Param("status") StaffStatus status,
                               @Param("memberId") UUID memberId,
                               Pageable pageable);
}
