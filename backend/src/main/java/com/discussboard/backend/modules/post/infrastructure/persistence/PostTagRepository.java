package com.discussboard.backend.modules.post.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.post.domain.PostTag;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostTagRepository extends JpaRepository<PostTag, UUID> {

    @Query("select t.tagId from PostTag t where t.post.id = :postId order by t.createdAt asc")
    List<UUID> findTagIdsByPostId(@Param("postId") UUID postId);

    @Query("select count(t) > 0 from PostTag t where t.post.id = :postId and t.tagId = :tagId")
    boolean existsByPostIdAndTagId(@Param("postId") UUID postId, @Param("tagId") UUID tagId);

    @Query("select t from PostTag t where t.post.id = :postId and t.tagId = :tagId")
    Optional<PostTag> findByPostIdAndTagId(@Param("postId") UUID postId, @Param("tagId") UUID tagId);

    @Query(value = "select t from PostTag t where t.post.id = :postId",
            countQuery = "select count(t) from PostTag t where t.post.id = :postId")
    Page<PostTag> findByPostId(@Param("postId") UUID postId, Pageable pageable);
}
