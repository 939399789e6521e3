package com.clapgrow.inbox.api.repository;

import com.clapgrow.inbox.api.entity.Message;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MessageRepository extends JpaRepository<Message, UUID> {

    Optional<Message> findByConversationIdAndPlatformMessageId(UUID conversationId, String platformMessageId);

    List<Message> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);

    /**
     * Row-locked read used by status updates so concurrent callbacks for the same
     * message apply one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Message m WHERE m.id = :id")
    Optional<Message> findByIdForUpdate(@Param("id") UUID id);
}
