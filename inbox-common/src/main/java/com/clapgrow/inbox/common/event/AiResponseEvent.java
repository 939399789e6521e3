package com.clapgrow.inbox.common.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reply produced by the AI responder for a conversation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiResponseEvent implements DomainEvent {

    private UUID eventId;
    private UUID conversationId;
    private UUID organizationId;
    /** Inbound message the reply answers, if the responder tracked it. */
    private UUID replyToMessageId;
    private String content;
    private Double confidenceScore;
    private LocalDateTime createdAt;

    @Override
    public String partitionKey() {
        return conversationId != null ? conversationId.toString() : DomainEvent.super.partitionKey();
    }
}
