package com.discussboard.backend.modules.comment.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.comment.domain.CommentEditHistory;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentEditHistoryRepository extends JpaRepository<CommentEditHistory, UUID> {

    @Query(value = """
            select h
              from CommentEditHistory h
             where h.comment.id = :commentId
               and (:editorId is null or h.editor.id = :editorId)
            """,
            countQuery = """
            select count(h)
              from CommentEditHistory h
             where h.comment.id = :commentId
               and (:editorId is null or h.editor.id = :editorId)
            """)
    Page<CommentEditHistory> search(@Param("commentId") UUID commentId, @Param("editorId") UUID editorId,
                                    Pageable pageable);

    @Query("select h from CommentEditHistory h where h.id = :id and h.comment.id = :commentId")
    Optional<CommentEditHistory> findByIdAndCommentId(@Param("id") UUID id, @Param("commentId") UUID commentId);
}
