package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.common.enums.MessageDirection;
import com.clapgrow.inbox.common.enums.MessageStatus;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.enums.SenderType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

@Getter
@Builder
@ToString(exclude = {"content", "attachments", "metadata"})
public class CreateMessageCommand {

    private final UUID conversationId;
    private final UUID organizationId;
    private final MessageDirection direction;
    private final SenderType senderType;
    private final UUID senderId;
    private final MessageType messageType;
    private final String content;
    private final String mediaUrl;
    private final JsonNode attachments;
    private final JsonNode metadata;

    /** When set, a second create for the same conversation returns the first message. */
    private final String platformMessageId;

    /** Defaults to PENDING. Inbound messages are created already DELIVERED. */
    private final MessageStatus initialStatus;

    private final boolean aiGenerated;
    private final Double aiConfidenceScore;
}
