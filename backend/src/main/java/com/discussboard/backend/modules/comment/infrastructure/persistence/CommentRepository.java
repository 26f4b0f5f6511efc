package com.discussboard.backend.modules.comment.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.comment.domain.Comment;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentRepository extends JpaRepository<Comment, UUID> {

    @Query("select c from Comment c join fetch c.author where c.id = :id and c.deletedAt is null")
    Optional<Comment> findActiveById(@Param("id") UUID id);

    @Query("""
            select c
              from Comment c
              join fetch c.author
             where c.id = :id
               and c.post.id = :postId
               and c.deletedAt is null
            """)
    Optional<Comment> findActiveByIdAndPostId(@Param("id") UUID id, @Param("postId") UUID postId);

    @Query(value = """
            select c
              from Comment c
              join fetch c.author a
             where c.deletedAt is null
               and c.post.id = :postId
               and (:authorId is null or a.id = :authorId)
               and (:parentId is null or c.parent.id = :parentId)
               and (:keywordPattern is null or lower(c.content) like :keywordPattern escape '\\')
            """,
            countQuery = """
            select count(c)
              from Comment c
             where c.deletedAt is null
               and c.post.id = :postId
               and (:authorId is null or c.author.id = :authorId)
               and (:parentId is null or c.parent.id = :parentId)
               and (:keywordPattern is null or lower(c.content) like :keywordPattern escape '\\')
            """)
    Page<Comment> search(
            @Param("postId") UUID postId,
            @Param("authorId") UUID authorId,
            @Param("parentId") UUID parentId,
            @Param("keywordPattern") String keywordPattern,
            Pageable pageable
    );
}
