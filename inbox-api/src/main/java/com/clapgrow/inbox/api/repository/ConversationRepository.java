package com.clapgrow.inbox.api.repository;

import com.clapgrow.inbox.api.entity.Conversation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    /**
     * Locks the conversation row so concurrent message creates update the
     * last-message preview one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Conversation c WHERE c.id = :id")
    Optional<Conversation> findByIdForUpdate(@Param("id") UUID id);

    @Query(value = "SELECT * FROM conversations WHERE organization_id = :organizationId AND user_id = :userId " +
                   "AND contact_id = :contactId AND medium_id = :mediumId AND is_active",
           nativeQuery = true)
    Optional<Conversation> findActive(@Param("organizationId") UUID organizationId,
                                      @Param("userId") UUID userId,
                                      @Param("contactId") UUID contactId,
                                      @Param("mediumId") int mediumId);

    @Query(value = "SELECT * FROM conversations WHERE organization_id = :organizationId AND user_id = :userId " +
                   "AND contact_id = :contactId AND medium_id = :mediumId AND is_active",
           nativeQuery = true)
    List<Conversation> findAllActive(@Param("organizationId") UUID organizationId,
                                     @Param("userId") UUID userId,
                                     @Param("contactId") UUID contactId,
                                     @Param("mediumId") int mediumId);

    /**
     * Conditional insert backed by the partial unique index on the active tuple.
     * New conversations start OPEN, LOW priority, with AI replies enabled.
     *
     * @return 1 if this call created the active conversation, 0 if one already existed
     */
    @Modifying
    @Query(value = "INSERT INTO conversations (id, organization_id, user_id, contact_id, medium_id, " +
                   "is_active, is_archived, is_deleted, status, priority, ai_enabled, created_at, updated_at) " +
                   "VALUES (:id, :organizationId, :userId, :contactId, :mediumId, " +
                   "true, false, false, 'OPEN', 'LOW', true, :now, :now) " +
                   "ON CONFLICT (organization_id, user_id, contact_id, medium_id) WHERE is_active DO NOTHING",
           nativeQuery = true)
    int insertActiveIfAbsent(@Param("id") UUID id,
                             @Param("organizationId") UUID organizationId,
                             @Param("userId") UUID userId,
                             @Param("contactId") UUID contactId,
                             @Param("mediumId") int mediumId,
                             @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE conversations SET is_active = false, updated_at = :now " +
                   "WHERE organization_id = :organizationId AND user_id = :userId AND contact_id = :contactId " +
                   "AND medium_id = :mediumId AND is_active AND id <> :keepId",
           nativeQuery = true)
    int deactivateOthers(@Param("organizationId") UUID organizationId,
                         @Param("userId") UUID userId,
                         @Param("contactId") UUID contactId,
                         @Param("mediumId") int mediumId,
                         @Param("keepId") UUID keepId,
                         @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE conversations SET is_active = false, updated_at = :now WHERE id = :id AND is_active",
           nativeQuery = true)
    int deactivate(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
