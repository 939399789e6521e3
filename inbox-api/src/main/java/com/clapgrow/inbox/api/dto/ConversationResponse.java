package com.clapgrow.inbox.api.dto;

import com.clapgrow.inbox.api.entity.Conversation;
import com.clapgrow.inbox.api.enums.ConversationPriority;
import com.clapgrow.inbox.api.enums.ConversationStatus;
import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.SenderType;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
public class ConversationResponse {
    private UUID id;
    private UUID organizationId;
    private UUID userId;
    private UUID contactId;
    private Medium medium;
    private boolean active;
    private ConversationStatus status;
    private ConversationPriority priority;
    private boolean aiEnabled;
    private LocalDateTime lastMessageAt;
    private SenderType lastMessageByType;
    private String lastMessageContent;

    public static ConversationResponse from(Conversation conversation) {
        return ConversationResponse.builder()
            .id(conversation.getId())
            .organizationId(conversation.getOrganizationId())
            .userId(conversation.getUserId())
            .contactId(conversation.getContactId())
            .medium(conversation.getMedium())
            .active(Boolean.TRUE.equals(conversation.getIsActive()))
            .status(conversation.getStatus())
            .priority(conversation.getPriority())
            .aiEnabled(Boolean.TRUE.equals(conversation.getAiEnabled()))
            .lastMessageAt(conversation.getLastMessageAt())
            .lastMessageByType(conversation.getLastMessageByType())
            .lastMessageContent(conversation.getLastMessageContent())
            .build();
    }
}
