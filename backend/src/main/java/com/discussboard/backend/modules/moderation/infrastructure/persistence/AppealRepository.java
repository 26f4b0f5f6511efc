package com.discussboard.backend.modules.moderation.infrastructure.persistence;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.moderation.domain.Appeal;
import com.discussboard.backend.modules.moderation.domain.AppealStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppealRepository extends JpaRepository<Appeal, UUID> {

    @Query("select a from Appeal a where a.id = :id and a.deletedAt is null")
    Optional<Appeal> findActiveById(@Param("id") UUID id);

    @Query("""
            select count(a) > 0
              from Appeal a
             where a.deletedAt is null
               and a.moderationAction.id = :actionId
               and a.status in :statuses
            """)
    boolean existsForActionWithStatus(@Param("actionId") UUID actionId,
                                      @Param("statuses") Collection<AppealStatus> statuses);

    @Query(value = """
            select a
              from Appeal a
             where a.deletedAt is null
               and (:status is null or a.status = :status)
               and (:appellantId is null or a.appellant.id = :appellantId)
               and (:actionId is null or a.moderationAction.id = :actionId)
            """,
            countQuery = """
            select count(a)
              from Appeal a
             where a.deletedAt is null
               and (:status is null or a.status = :status)
               and (:appellantId is null or a.appellant.id = :appellantId)
               and (:actionId is null or a.moderationAction.id = :actionId)
            """)
    Page<Appeal> search(
            @Param("status") AppealStatus status,
            @Param("appellantId") UUID appellantId,
            @Param("actionId") UUID actionId,
            Pageable pageable
    );
}
