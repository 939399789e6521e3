package com.clapgrow.inbox.api.repository;

import com.clapgrow.inbox.api.entity.ProcessedEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEvent, ProcessedEvent.Key> {

    boolean existsByEventIdAndConsumer(UUID eventId, String consumer);

    @Modifying
    @Query(value = "INSERT INTO processed_events (event_id, consumer, processed_at) VALUES (:eventId, :consumer, :now) " +
                   "ON CONFLICT (event_id, consumer) DO NOTHING",
           nativeQuery = true)
    int markProcessed(@Param("eventId") UUID eventId,
                      @Param("consumer") String consumer,
                      @Param("now") LocalDateTime now);
}
