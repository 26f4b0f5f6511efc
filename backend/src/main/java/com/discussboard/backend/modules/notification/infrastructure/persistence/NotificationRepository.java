package com.discussboard.backend.modules.notification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.discussboard.backend.modules.notification.domain.DeliveryChannel;
import com.discussboard.backend.modules.notification.domain.DeliveryStatus;
import com.discussboard.backend.modules.notification.domain.Notification;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    @Query("select n from Notification n where n.id = :id and n.deletedAt is null")
    Optional<Notification> findActiveById(@Param("id") UUID id);

    @Query(value = """
            select n
              from Notification n
             where n.deletedAt is null
               and (:userAccountId is null or n.userAccountId = :userAccountId)
               and (:eventType is null or n.eventType = :eventType)
               and (:channel is null or n.deliveryChannel = :channel)
               and (:status is null or n.deliveryStatus = :status)
               and (:createdFrom is null or n.createdAt >= :createdFrom)
               and (:createdTo is null or n.createdAt <= :createdTo)
            """,
            countQuery = """
            select count(n)
              from Notification n
             where n.deletedAt is null
               and (:userAccountId is null or n.userAccountId = :userAccountId)
               and (:eventType is null or n.eventType = :eventType)
               and (:channel is null or n.deliveryChannel = :channel)
               and (:status is null or n.deliveryStatus = :status)
               and (:createdFrom is null or n.createdAt >= :createdFrom)
               and (:createdTo is null or n.createdAt <= :createdTo)
            """)
    Page<Notification> search(
            @Param("userAccountId") UUID userAccountId,
            @Param("eventType") String eventType,
            @Param("channel") DeliveryChannel channel,
            @Param("status") DeliveryStatus status,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            Pageable pageable
    );
}
