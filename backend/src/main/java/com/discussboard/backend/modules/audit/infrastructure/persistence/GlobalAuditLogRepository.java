package com.discussboard.backend.modules.audit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.discussboard.backend.modules.audit.domain.GlobalAuditLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GlobalAuditLogRepository extends JpaRepository<GlobalAuditLog, UUID> {

    @Query(value = """
            select l
              from GlobalAuditLog l
             where (:actorType is null or l.actorType = :actorType)
               and (:actorId is null or l.actorId = :actorId)
               and (:actionCategory is null or l.actionCategory = :actionCategory)
               and (:targetTable is null or l.targetTable = :targetTable)
               and (:targetId is null or l.targetId = :targetId)
               and (:descriptionPattern is null or lower(l.eventDescription) like :descriptionPattern escape '\\')
               and (:createdFrom is null or l.createdAt >= :createdFrom)
               and (:createdTo is null or l.createdAt <= :createdTo)
            """,
            countQuery = """
            select count(l)
              from GlobalAuditLog l
             where (:actorType is null or l.actorType = :actorType)
               and (:actorId is null or l.actorId = :actorId)
               and (:actionCategory is null or l.actionCategory = :actionCategory)
               and (:targetTable is null or l.targetTable = :targetTable)
               and (:targetId is null or l.targetId = :targetId)
               and (:descriptionPattern is null or lower(l.eventDescription) like :descriptionPattern escape '\\')
               and (:createdFrom is null or l.createdAt >= :createdFrom)
               and (:createdTo is null or l.createdAt <= :createdTo)
            """)
    Page<GlobalAuditLog> search(
            @Param("actorType") String actorType,
            @Param("actorId") UUID actorId,
            @Param("actionCategory") String actionCategory,
            @Param("targetTable") String targetTable,
            @Param("targetId") String targetId,
            @Param("descriptionPattern") String descriptionPattern,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            Pageable pageable
    );
}
