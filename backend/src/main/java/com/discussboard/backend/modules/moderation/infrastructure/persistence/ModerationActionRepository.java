package com.discussboard.backend.modules.moderation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.moderation.domain.ModerationAction;
import com.discussboard.backend.modules.moderation.domain.ModerationActionStatus;
import com.discussboard.backend.modules.moderation.domain.ModerationActionType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ModerationActionRepository extends JpaRepository<ModerationAction, UUID> {

    @Query("select a from ModerationAction a where a.id = :id and a.deletedAt is null")
    Optional<ModerationAction> findActiveById(@Param("id") UUID id);

    @Query(value = """
            select a
              from ModerationAction a
             where a.deletedAt is null
               and (:moderatorId is null or a.moderator.id = :moderatorId)
               and (:targetMemberId is null or a.targetMember.id = :targetMemberId)
               and (:targetPostId is null or a.targetPost.id = :targetPostId)
               and (:targetCommentId is null or a.targetComment.id = :targetCommentId)
               and (:actionType is null or a.actionType = :actionType)
               and (:status is null or a.status = :status)
               and (:createdFrom is null or a.createdAt >= :createdFrom)
               and (:createdTo is null or a.createdAt <= :createdTo)
            """,
            countQuery = """
            select count(a)
              from ModerationAction a
             where a.deletedAt is null
               and (:moderatorId is null or a.moderator.id = :moderatorId)
               and (:targetMemberId is null or a.targetMember.id = :targetMemberId)
               and (:targetPostId is null or a.targetPost.id = :targetPostId)
               and (:targetCommentId is null or a.targetComment.id = :targetCommentId)
               and (:actionType is null or a.actionType = :actionType)
               and (:status is null or a.status = :status)
               and (:createdFrom is null or a.createdAt >= :createdFrom)
               and (:createdTo is null or a.createdAt <= :createdTo)
            """)
    Page<ModerationAction> search(
            @Param("moderatorId") UUID moderatorId,
            @Param("targetMemberId") UUID targetMemberId,
            @Param("targetPostId") UUID targetPostId,
            @Param("targetCommentId") UUID targetCommentId,
            @Param("actionType") ModerationActionType actionType,
            @Param("status") ModerationActionStatus status,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            Pageable pageable
    );
}
