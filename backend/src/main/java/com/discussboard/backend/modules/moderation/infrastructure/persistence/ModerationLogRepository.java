package com.discussboard.backend.modules.moderation.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.moderation.domain.ModerationLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ModerationLogRepository extends JpaRepository<ModerationLog, UUID> {

    @Query("select l from ModerationLog l where l.id = :id and l.relatedAction.id = :actionId")
    Optional<ModerationLog> findByIdAndActionId(@Param("id") UUID id, @Param("actionId") UUID actionId);

    @Query(value = """
            select l
              from ModerationLog l
             where l.relatedAction.id = :actionId
               and (:eventType is null or l.eventType = :eventType)
               and (:actorMemberId is null or l.actor.id = :actorMemberId)
            """,
            countQuery = """
            select count(l)
              from ModerationLog l
             where l.relatedAction.id = :actionId
               and (:eventType is null or l.eventType = :eventType)
               and (:actorMemberId is null or l.actor.id = :actorMemberId)
            """)
    Page<ModerationLog> searchByAction(
            @Param("actionId") UUID actionId,
            @Param("eventType") String eventType,
            @Param("actorMemberId") UUID actorMemberId,
            Pageable pageable
    );
}
