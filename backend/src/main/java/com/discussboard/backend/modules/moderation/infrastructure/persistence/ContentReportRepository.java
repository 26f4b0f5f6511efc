package com.discussboard.backend.modules.moderation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.moderation.domain.ContentReport;
import com.discussboard.backend.modules.moderation.domain.ContentType;
import com.discussboard.backend.modules.moderation.domain.ReportStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContentReportRepository extends JpaRepository<ContentReport, UUID> {

    @Query("select r from ContentReport r where r.id = :id and r.deletedAt is null")
    Optional<ContentReport> findActiveById(@Param("id") UUID id);

    @Query("""
            select count(r) > 0
              from ContentReport r
             where r.deletedAt is null
               and r.reporter.id = :reporterId
               and r.contentPost.id = :postId
            """)
    boolean existsActiveByReporterAndPost(@Param("reporterId") UUID reporterId, @Param("postId") UUID postId);

    @Query("""
            select count(r) > 0
              from ContentReport r
             where r.deletedAt is null
               and r.reporter.id = :reporterId
               and r.contentComment.id = :commentId
            """)
    boolean existsActiveByReporterAndComment(@Param("reporterId") UUID reporterId,
                                             @Param("commentId") UUID commentId);

    @Query(value = """
            select r
              from ContentReport r
             where r.deletedAt is null
               and (:reporterId is null or r.reporter.id = :reporterId)
               and (:contentType is null or r.contentType = :contentType)
               and (:status is null or r.status = :status)
               and (:reasonPattern is null or lower(r.reason) like :reasonPattern escape '\\')
               and (:createdFrom is null or r.createdAt >= :createdFrom)
               and (:createdTo is null or r.createdAt <= :createdTo)
            """,
            countQuery = """
            select count(r)
              from ContentReport r
             where r.deletedAt is null
               and (:reporterId is null or r.reporter.id = :reporterId)
               and (:contentType is null or r.contentType = :contentType)
               and (:status is null or r.status = :status)
               and (:reasonPattern is null or lower(r.reason) like :reasonPattern escape '\\')
               and (:createdFrom is null or r.createdAt >= :createdFrom)
               and (:createdTo is null or r.createdAt <= :createdTo)
            """)
    Page<ContentReport> search(
            @Param("reporterId") UUID reporterId,
            @Param("contentType") ContentType contentType,
            @Param("status") ReportStatus status,
            @Param("reasonPattern") String reasonPattern,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            Pageable pageable
    );
}
