package com.clapgrow.inbox.api.repository;

import com.clapgrow.inbox.api.entity.WebhookEvent;
import com.clapgrow.inbox.api.enums.WebhookEventStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, UUID> {

    /**
     * Events with retry budget left that either failed transiently and have not been
     * touched since {@code threshold}, or never finished a first attempt and have sat
     * untouched since {@code stalledThreshold}.
     */
    @Query("SELECT w FROM WebhookEvent w WHERE w.status = :status AND w.retryCount < :maxRetries " +
           "AND ((w.retryCount > 0 AND w.updatedAt < :threshold) " +
           "OR (w.retryCount = 0 AND w.updatedAt < :stalledThreshold)) " +
           "ORDER BY w.updatedAt ASC")
    List<WebhookEvent> findRetryCandidates(@Param("status") WebhookEventStatus status,
                                           @Param("maxRetries") int maxRetries,
                                           @Param("threshold") LocalDateTime threshold,
                                           @Param("stalledThreshold") LocalDateTime stalledThreshold,
                                           Pageable pageable);

    /**
     * Claims a retry candidate by bumping {@code updated_at}. Only one scheduler
     * instance sees a row count of 1 for a given candidate and retry count; the
     * others skip it.
     *
     * @return 1 if claimed, 0 if another instance got there first or the event moved on
     */
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE webhook_events SET updated_at = :now " +
                   "WHERE id = :id AND status = 'PENDING' AND retry_count = :retryCount AND updated_at < :threshold",
           nativeQuery = true)
    int claimForRetry(@Param("id") UUID id,
                      @Param("retryCount") int retryCount,
                      @Param("threshold") LocalDateTime threshold,
                      @Param("now") LocalDateTime now);

    long countByStatus(WebhookEventStatus status);
}
