package com.clapgrow.inbox.api.entity;

import com.clapgrow.inbox.api.config.PostgreSQLJSONBType;
import com.clapgrow.inbox.common.enums.MessageDirection;
import com.clapgrow.inbox.common.enums.MessageStatus;
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

@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_conversation_created", columnList = "conversation_id, created_at"),
    @Index(name = "idx_messages_organization", columnList = "organization_id")
})
@Getter
@Setter
@NoArgsConstructor
public class Message extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "conversation_id", nullable = false)
    private UUID conversationId;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "sender_type", nullable = false)
    private SenderType senderType;

    @Column(name = "sender_id")
    private UUID senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 10)
    private MessageDirection direction;

    @Column(name = "message_type", nullable = false)
    private MessageType messageType;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "media_url", length = 1000)
    private String mediaUrl;

    @Column(name = "attachments", columnDefinition = "JSONB")
    @Type(PostgreSQLJSONBType.class)
    private JsonNode attachments;

    @Column(name = "is_broadcast", nullable = false)
    private Boolean isBroadcast = false;

    @Column(name = "is_order_message", nullable = false)
    private Boolean isOrderMessage = false;

    @Column(name = "metadata", columnDefinition = "JSONB")
    @Type(PostgreSQLJSONBType.class)
    private JsonNode metadata;

    /** Platform-native id; unique per conversation when present. */
    @Column(name = "platform_message_id", length = 255)
    private String platformMessageId;

    @Column(name = "ai_generated", nullable = false)
    private Boolean aiGenerated = false;

    @Column(name = "ai_confidence_score")
    private Double aiConfidenceScore;

    @Column(name = "status", nullable = false)
    private MessageStatus status = MessageStatus.PENDING;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;
}
