package com.discussboard.backend.modules.post.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.post.domain.PostEditHistory;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostEditHistoryRepository extends JpaRepository<PostEditHistory, UUID> {

    @Query(value = """
            select h
              from PostEditHistory h
             where h.post.id = :postId
               and (:editorId is null or h.editor.id = :editorId)
            """,
            countQuery = """
            select count(h)
              from PostEditHistory h
             where h.post.id = :postId
               and (:editorId is null or h.editor.id = :editorId)
            """)
    Page<PostEditHistory> search(@Param("postId") UUID postId, @Param("editorId") UUID editorId, Pageable pageable);

    @Query("select h from PostEditHistory h where h.id = :id and h.post.id = :postId")
    Optional<PostEditHistory> findByIdAndPostId(@Param("id") UUID id, @Param("postId") UUID postId);
}
