package com.discussboard.backend.modules.comment.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.comment.domain.CommentReaction;
import com.discussboard.backend.modules.post.domain.ReactionType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentReactionRepository extends JpaRepository<CommentReaction, UUID> {

    @Query("select r from CommentReaction r where r.id = :id and r.deletedAt is null")
    Optional<CommentReaction> findActiveById(@Param("id") UUID id);

    @Query("select r from CommentReaction r where r.member.id = :memberId and r.comment.id = :commentId")
    Optional<CommentReaction> findByMemberIdAndCommentId(@Param("memberId") UUID memberId,
                                                         @Param("commentId") UUID commentId);

    @Query(value = """
            select r
              from CommentReaction r
             where r.deletedAt is null
               and r.member.id = :memberId
               and (:commentId is null or r.comment.id = :commentId)
               and (:reactionType is null or r.reactionType = :reactionType)
            """,
            countQuery = """
            select count(r)
              from CommentReaction r
             where r.deletedAt is null
               and r.member.id = :memberId
               and (:commentId is null or r.comment.id = :commentId)
               and (:reactionType is null or r.reactionType = :reactionType)
            """)
    Page<CommentReaction> searchOwn(
            @Param("memberId") UUID memberId,
            @Param("commentId") UUID commentId,
            @Param("reactionType") ReactionType reactionType,
            Pageable pageable
    );
}
