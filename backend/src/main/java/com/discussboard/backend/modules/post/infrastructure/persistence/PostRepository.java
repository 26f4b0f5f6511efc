package com.discussboard.backend.modules.post.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.post.domain.Post;
import com.discussboard.backend.modules.post.domain.PostStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostRepository extends JpaRepository<Post, UUID> {

    @Query("select p from Post p join fetch p.author where p.id = :id and p.deletedAt is null")
    Optional<Post> findActiveById(@Param("id") UUID id);

    @Query(value = """
            select p
              from Post p
              join fetch p.author a
             where p.deletedAt is null
               and (:keywordPattern is null
                    or lower(p.title) like :keywordPattern escape '\\'
                    or lower(p.body) like :keywordPattern escape '\\')
               and (:authorId is null or a.id = :authorId)
               and (:status is null or p.businessStatus = :status)
               and (:tagId is null or exists (
                    select 1 from PostTag t where t.post = p and t.tagId = :tagId))
               and (:createdFrom is null or p.createdAt >= :createdFrom)
               and (:createdTo is null or p.createdAt <= :createdTo)
            """,
            countQuery = """
            select count(p)
              from Post p
             where p.deletedAt is null
               and (:keywordPattern is null
                    or lower(p.title) like :keywordPattern escape '\\'
                    or lower(p.body) like :keywordPattern escape '\\')
               and (:authorId is null or p.author.id = :authorId)
               and (:status is null or p.businessStatus = :status)
               and (:tagId is null or exists (
                    select 1 from PostTag t where t.post = p and t.tagId = :tagId))
               and (:createdFrom is null or p.createdAt >= :createdFrom)
               and (:createdTo is null or p.createdAt <= :createdTo)
            """)
    Page<Post> search(
            @Param("keywordPattern") String keywordPattern,
            @Param("authorId") UUID authorId,
            @Param("status") PostStatus status,
            @Param("tagId") UUID tagId,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            Pageable pageable
    );
}
