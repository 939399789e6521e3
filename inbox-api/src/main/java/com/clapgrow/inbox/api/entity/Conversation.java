package com.clapgrow.inbox.api.entity;

import com.clapgrow.inbox.api.config.PostgreSQLJSONBType;
import com.clapgrow.inbox.api.enums.ConversationPriority;
import com.clapgrow.inbox.api.enums.ConversationStatus;
import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.enums.SenderType;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Type;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Thread between an organization user and a contact on one medium.
 *
 * <p>At most one row per (organization, user, contact, medium) has
 * {@code is_active = true}. A partial unique index enforces that; rows are only
 * ever created through {@code ConversationRepository#insertActiveIfAbsent}.
 *
 * <p>The {@code last_message_*} columns are a denormalized preview of the newest
 * message, maintained by {@code MessageLifecycleService}.
 */
@Entity
@Table(name = "conversations")
@Getter
@Setter
@NoArgsConstructor
public class Conversation extends BaseAuditableEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "contact_id", nullable = false)
    private UUID contactId;

    @Column(name = "medium_id", nullable = false)
    private Medium medium;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "is_archived", nullable = false)
    private Boolean isArchived = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConversationStatus status = ConversationStatus.OPEN;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 20)
    private ConversationPriority priority = ConversationPriority.LOW;

    @Column(name = "ai_enabled", nullable = false)
    private Boolean aiEnabled = true;

    @Column(name = "ai_config", columnDefinition = "JSONB")
    @Type(PostgreSQLJSONBType.class)
    private JsonNode aiConfig;

    @Column(name = "metadata", columnDefinition = "JSONB")
    @Type(PostgreSQLJSONBType.class)
    private JsonNode metadata;

    @Column(name = "last_message_at")
    private LocalDateTime lastMessageAt;

    @Column(name = "last_human_message_at")
    private LocalDateTime lastHumanMessageAt;

    @Column(name = "last_ai_message_at")
    private LocalDateTime lastAiMessageAt;

    @Column(name = "last_message_by_id")
    private UUID lastMessageById;

    @Column(name = "last_message_by_type")
    private SenderType lastMessageByType;

    @Column(name = "last_message_by_name", length = 100)
    private String lastMessageByName;

    @Column(name = "last_message_content", length = 255)
    private String lastMessageContent;

    @Column(name = "last_message_type")
    private MessageType lastMessageType;

    @Column(name = "last_message_media_url", length = 1000)
    private String lastMessageMediaUrl;
}
