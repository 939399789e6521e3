package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.config.InboxProperties;
import com.clapgrow.inbox.api.entity.Contact;
import com.clapgrow.inbox.api.entity.Conversation;
import com.clapgrow.inbox.api.entity.Message;
import com.clapgrow.inbox.api.event.EventPublisher;
import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageDirection;
import com.clapgrow.inbox.common.enums.MessageStatus;
import com.clapgrow.inbox.common.enums.SenderType;
import com.clapgrow.inbox.common.event.MessageCreatedEvent;
import com.clapgrow.inbox.common.event.WebhookReceivedEvent;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Stores normalized inbound messages: contact, conversation, message, then the
 * message-created event for the AI responder.
 *
 * <p>Safe to run more than once for the same webhook. Contacts and conversations are
 * get-or-create, messages are idempotent on their platform id, and the event id is
 * derived from the message id, so a replay republishes the same event. Units the
 * platform sent without an id get one derived from the webhook event and their
 * position in it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundMessageService {

    static final String DERIVED_ID_PREFIX = "webhook:";

    private final ContactService contactService;
    private final SystemUserResolver systemUserResolver;
    private final ConversationResolver conversationResolver;
    private final MessageLifecycleService messageLifecycleService;
    private final EventPublisher eventPublisher;
    private final InboxProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @return number of messages stored or found already stored
     */
    public int ingest(WebhookReceivedEvent event) {
        Medium medium = Medium.fromTag(event.getPlatform())
            .orElseThrow(() -> new BadRequestException("Unknown platform in webhook event: " + event.getPlatform()));
        UUID organizationId = event.getOrganizationId();
        if (organizationId == null) {
            throw new BadRequestException("Webhook event " + event.getEventId() + " has no organization");
        }
        UUID userId = systemUserResolver.resolve(organizationId);

        int ingested = 0;
        List<CanonicalMessage> messages = event.getMessages();
        for (int index = 0; index < messages.size(); index++) {
            CanonicalMessage canonical = messages.get(index);
            try {
                ingestOne(event, medium, userId, canonical, index);
                ingested++;
            } catch (BadRequestException e) {
                // Retrying cannot fix the content of a single unit
                log.warn("Skipping inbound {} message {} from webhook event {}: {}", medium,
                    canonical.getPlatformMessageId(), event.getWebhookEventId(), e.getMessage());
            }
        }
        log.info("Ingested {}/{} message(s) from webhook event {}", ingested, event.getMessages().size(),
            event.getWebhookEventId());
        return ingested;
    }

    /**
     * Platform id of a unit, or {@code webhook:<eventId>:<index>} when the platform sent none.
     * Extraction is deterministic, so a replay of the same webhook event yields the same keys.
     */
    static String platformMessageIdFor(WebhookReceivedEvent event, CanonicalMessage canonical, int index) {
        String platformMessageId = canonical.getPlatformMessageId();
        if (platformMessageId != null && !platformMessageId.isBlank()) {
            return platformMessageId;
        }
        if (event.getWebhookEventId() == null) {
            return null;
        }
        return DERIVED_ID_PREFIX + event.getWebhookEventId() + ":" + index;
    }

    private void ingestOne(WebhookReceivedEvent event, Medium medium, UUID userId, CanonicalMessage canonical,
                           int index) {
        UUID organizationId = event.getOrganizationId();
        Contact contact = contactService.getOrCreate(organizationId, canonical.getOriginId());
        Conversation conversation = conversationResolver.resolve(organizationId, userId, contact.getId(), medium);

        ObjectNode metadata = objectMapper.valueToTree(canonical.getMetadata());
        if (event.getWebhookEventId() != null) {
            metadata.put("webhook_event_id", event.getWebhookEventId().toString());
        }

        Message message = messageLifecycleService.createMessage(CreateMessageCommand.builder()
            .conversationId(conversation.getId())
            .organizationId(organizationId)
            .direction(MessageDirection.INBOUND)
            .senderType(SenderType.CUSTOMER)
            .senderId(contact.getId())
            .messageType(canonical.getMessageType())
            .content(canonical.getContent())
            .mediaUrl(canonical.getMediaUrl())
            .metadata(metadata)
            .platformMessageId(platformMessageIdFor(event, canonical, index))
            .initialStatus(MessageStatus.DELIVERED)
            .build());

        MessageCreatedEvent created = MessageCreatedEvent.builder()
            .eventId(MessageCreatedEvent.eventIdFor(message.getId()))
            .messageId(message.getId())
            .conversationId(conversation.getId())
            .organizationId(organizationId)
            .contactId(contact.getId())
            .mediumId(medium.getCode())
            .direction(message.getDirection())
            .senderType(message.getSenderType())
            .messageType(message.getMessageType())
            .content(message.getContent())
            .mediaUrl(message.getMediaUrl())
            .aiEnabled(Boolean.TRUE.equals(conversation.getAiEnabled()))
            .createdAt(LocalDateTime.now())
            .build();
        eventPublisher.publish(properties.getEvents().getTopics().getMessageCreated(), created);
    }
}
