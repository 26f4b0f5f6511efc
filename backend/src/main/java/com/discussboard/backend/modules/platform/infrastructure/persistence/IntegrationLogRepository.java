package com.discussboard.backend.modules.platform.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.platform.domain.IntegrationLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IntegrationLogRepository extends JpaRepository<IntegrationLog, UUID> {

    @Query("select l from IntegrationLog l where l.id = :id and l.deletedAt is null")
    Optional<IntegrationLog> findActiveById(@Param("id") UUID id);

    @Query(value = """
            select l
              from IntegrationLog l
             where l.deletedAt is null
               and (:userAccountId is null or l.userAccountId = :userAccountId)
               and (:integrationType is null or l.integrationType = :integrationType)
               and (:integrationPartner is null or l.integrationPartner = :integrationPartner)
               and (:integrationStatus is null or l.integrationStatus = :integrationStatus)
               and (:triggeredEvent is null or l.triggeredEvent = :triggeredEvent)
               and (:createdFrom is null or l.createdAt >= :createdFrom)
               and (:createdTo is null or l.createdAt <= :createdTo)
            """,
            countQuery = """
            select count(l)
              from IntegrationLog l
             where l.deletedAt is null
               and (:userAccountId is null or l.userAccountId = :userAccountId)
               and (:integrationType is null or l.integrationType = :integrationType)
               and (:integrationPartner is null or l.integrationPartner = :integrationPartner)
               and (:integrationStatus is null or l.integrationStatus = :integrationStatus)
               and (:triggeredEvent is null or l.triggeredEvent = :triggeredEvent)
               and (:createdFrom is null or l.createdAt >= :createdFrom)
               and (:createdTo is null or l.createdAt <= :createdTo)
            """)
    Page<IntegrationLog> search(
            @Param("userAccountId") UUID userAccountId,
            @Param("integrationType") String integrationType,
            @Param("integrationPartner") String integrationPartner,
            @Param("integrationStatus") String integrationStatus,
            @Param("triggeredEvent") String triggeredEvent,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            Pageable pageable
    );
}
