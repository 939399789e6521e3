package com.clapgrow.inbox.common.event;

import com.clapgrow.inbox.common.enums.MessageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Outbound message ready for the delivery worker of its medium.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDeliveryEvent implements DomainEvent {

    private UUID eventId;
    private UUID messageId;
    private UUID conversationId;
    private UUID organizationId;
    private UUID contactId;
    private int mediumId;
    private MessageType messageType;
    private String content;
    private String mediaUrl;
    private LocalDateTime createdAt;

    @Override
    public String partitionKey() {
        return conversationId != null ? conversationId.toString() : DomainEvent.super.partitionKey();
    }

    public static UUID eventIdFor(UUID messageId) {
        return UUID.nameUUIDFromBytes(("message-delivery:" + messageId).getBytes(StandardCharsets.UTF_8));
    }
}
