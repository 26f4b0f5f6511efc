package com.discussboard.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.auth.domain.Moderator;
import com.discussboard.backend.modules.auth.domain.StaffStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ModeratorRepository extends JpaRepository<Moderator, UUID> {

    @Query("select m from Moderator m join fetch m.member where m.id = :id and m.deletedAt is null")
    Optional<Moderator> findActiveById(@Param("id") UUID id);

    @Query("""
            select m
              from Moderator m
             where m.member.id = :memberId
               and m.deletedAt is null
               and m.revokedAt is null
               and m.status = com.discussboard.backend.modules.auth.domain.StaffStatus.ACTIVE
            """)
    Optional<Moderator> findCurrentByMemberId(@Param("memberId") UUID memberId);

    @Query(value = """
            select m
              from Moderator m
             where m.deletedAt is null
               and (:status is null or m.status = :status)
               and (:memberId is null or m.member.id = :memberId)
               and (:assignedById is null or m.assignedBy.id = :assignedById)
            """,
            countQuery = """
            select count(m)
              from Moderator m
             where m.deletedAt is null
               and (:status is null or m.status = :status)
               and (:memberId is null or m.member.id = :memberId)
               and (:assignedById is null or m.assignedBy.id = :assignedById)
            """)
    Page<Moderator> search(@Param("status") StaffStatus status,
                           @Param("memberId") UUID memberId,
                           @Param("assignedById") UUID assignedById,
                           Pageable pageable);
}
