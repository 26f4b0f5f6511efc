package com.discussboard.backend.modules.post.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.post.domain.PostReaction;
import com.discussboard.backend.modules.post.domain.ReactionType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostReactionRepository extends JpaRepository<PostReaction, UUID> {

    @Query("select r from PostReaction r where r.id = :id and r.deletedAt is null")
    Optional<PostReaction> findActiveById(@Param("id") UUID id);

    /**
     * Includes soft-deleted rows so a withdrawn reaction can be revived.
     */
    @Query("select r from PostReaction r where r.member.id = :memberId and r.post.id = :postId")
    Optional<PostReaction> findByMemberIdAndPostId(@Param("memberId") UUID memberId, @Param("postId") UUID postId);

    @Query(value = """
            select r
              from PostReaction r
             where r.deletedAt is null
               and r.member.id = :memberId
               and (:postId is null or r.post.id = :postId)
               and (:reactionType is null or r.reactionType = :reactionType)
            """,
            countQuery = """
            select count(r)
              from PostReaction r
             where r.deletedAt is null
               and r.member.id = :memberId
               and (:postId is null or r.post.id = :postId)
               and (:reactionType is null or r.reactionType = :reactionType)
            """)
    Page<PostReaction> searchOwn(
            @Param("memberId") UUID memberId,
            @Param("postId") UUID postId,
            @Param("reactionType") ReactionType reactionType,
            Pageable pageable
    );
}
