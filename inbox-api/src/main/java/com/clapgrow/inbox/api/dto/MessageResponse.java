package com.clapgrow.inbox.api.dto;

import com.clapgrow.inbox.api.entity.Message;
import com.clapgrow.inbox.common.enums.MessageDirection;
import com.clapgrow.inbox.common.enums.MessageStatus;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.enums.SenderType;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
public class MessageResponse {
    private UUID id;
    private UUID conversationId;
    private MessageDirection direction;
    private SenderType senderType;
    private UUID senderId;
    private MessageType messageType;
    private String content;
    private String mediaUrl;
    private String platformMessageId;
    private boolean aiGenerated;
    private MessageStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime readAt;
    private LocalDateTime failedAt;
    private String failureReason;

    public static MessageResponse from(Message message) {
        return MessageResponse.builder()
            .id(message.getId())
            .conversationId(message.getConversationId())
            .direction(message.getDirection())
            .senderType(message.getSenderType())
            .senderId(message.getSenderId())
            .messageType(message.getMessageType())
            .content(message.getContent())
            .mediaUrl(message.getMediaUrl())
            .platformMessageId(message.getPlatformMessageId())
            .aiGenerated(Boolean.TRUE.equals(message.getAiGenerated()))
            .status(message.getStatus())
            .createdAt(message.getCreatedAt())
            .deliveredAt(message.getDeliveredAt())
            .readAt(message.getReadAt())
            .failedAt(message.getFailedAt())
            .failureReason(message.getFailureReason())
            .build();
    }
}
