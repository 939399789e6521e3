package com.clapgrow.inbox.common.event;

import com.clapgrow.inbox.common.enums.MessageDirection;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.enums.SenderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Published after an inbound message is stored. The AI responder consumes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageCreatedEvent implements DomainEvent {

    private UUID eventId;
    private UUID messageId;
    private UUID conversationId;
    private UUID organizationId;
    private UUID contactId;
    private int mediumId;
    private MessageDirection direction;
    private SenderType senderType;
    private MessageType messageType;
    private String content;
    private String mediaUrl;
    private boolean aiEnabled;
    private LocalDateTime createdAt;

    @Override
    public String partitionKey() {
        return conversationId != null ? conversationId.toString() : DomainEvent.super.partitionKey();
    }

    public static UUID eventIdFor(UUID messageId) {
        return UUID.nameUUIDFromBytes(("message-created:" + messageId).getBytes(StandardCharsets.UTF_8));
    }
}
