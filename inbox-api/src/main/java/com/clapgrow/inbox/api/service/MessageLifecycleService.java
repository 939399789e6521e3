package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.config.InboxProperties;
import com.clapgrow.inbox.api.entity.Conversation;
import com.clapgrow.inbox.api.entity.Message;
import com.clapgrow.inbox.api.event.EventPublisher;
import com.clapgrow.inbox.api.repository.ConversationRepository;
import com.clapgrow.inbox.api.repository.MessageRepository;
import com.clapgrow.inbox.common.enums.MessageDirection;
import com.clapgrow.inbox.common.enums.MessageStatus;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.enums.SenderType;
import com.clapgrow.inbox.common.event.AiResponseEvent;
import com.clapgrow.inbox.common.event.MessageDeliveryEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates messages and moves them through their delivery lifecycle.
 *
 * <p>Terminal timestamps are asymmetric: {@code delivered_at} and {@code read_at} are
 * stamped on the way forward, {@code failed_at} only before delivery, and a stamped
 * timestamp is never cleared or overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageLifecycleService {

    static final int PREVIEW_MAX_LENGTH = 255;
    static final String DEFAULT_FAILURE_REASON = "Unknown failure";
    static final String AI_RESPONSE_EVENT_KEY = "ai_response_event_id";
    static final String AI_PLATFORM_ID_PREFIX = "ai:";

    private final MessageRepository messageRepository;
    private final ConversationRepository conversationRepository;
    private final StatusTransitionValidator statusTransitionValidator;
    private final EventPublisher eventPublisher;
    private final InboxProperties properties;
    private final InboxMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    /**
     * Stores a message and refreshes the conversation's last-message preview.
     *
     * <p>Idempotent on (conversation, platform message id): a repeated create returns the
     * stored message and leaves the conversation untouched.
     *
     * @throws ResourceNotFoundException if the conversation does not exist in the organization
     * @throws BadRequestException       if the command is incomplete or has no content for its type
     */
    public Message createMessage(CreateMessageCommand command) {
        if (command.getConversationId() == null || command.getOrganizationId() == null) {
            throw new BadRequestException("conversationId and organizationId are required");
        }
        if (command.getDirection() == null || command.getSenderType() == null || command.getMessageType() == null) {
            throw new BadRequestException("direction, senderType and messageType are required");
        }

        try {
            return transactionTemplate.execute(status -> createInTransaction(command));
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent delivery of the same platform message
            if (command.getPlatformMessageId() == null) {
                throw e;
            }
            Message existing = messageRepository.findByConversationIdAndPlatformMessageId(
                    command.getConversationId(), command.getPlatformMessageId())
                .orElseThrow(() -> e);
            log.info("Concurrent create of platform message {} resolved to message {}",
                command.getPlatformMessageId(), existing.getId());
            return existing;
        }
    }

    private Message createInTransaction(CreateMessageCommand command) {
        Conversation conversation = conversationRepository.findByIdForUpdate(command.getConversationId())
            .filter(c -> command.getOrganizationId().equals(c.getOrganizationId()))
            .orElseThrow(() -> ResourceNotFoundException.of("Conversation", command.getConversationId()));

        validateContent(command);

        if (command.getPlatformMessageId() != null) {
            Optional<Message> existing = messageRepository.findByConversationIdAndPlatformMessageId(
                conversation.getId(), command.getPlatformMessageId());
            if (existing.isPresent()) {
                log.debug("Platform message {} already stored as {}", command.getPlatformMessageId(),
                    existing.get().getId());
                return existing.get();
            }
        }

        LocalDateTime now = LocalDateTime.now();
        MessageStatus initialStatus = command.getInitialStatus() != null
            ? command.getInitialStatus() : MessageStatus.PENDING;

        Message message = new Message();
        message.setConversationId(conversation.getId());
        message.setOrganizationId(conversation.getOrganizationId());
        message.setDirection(command.getDirection());
        message.setSenderType(command.getSenderType());
        message.setSenderId(command.getSenderId());
        message.setMessageType(command.getMessageType());
        message.setContent(command.getContent() != null ? command.getContent() : "");
        message.setMediaUrl(command.getMediaUrl() != null ? command.getMediaUrl() : "");
        message.setAttachments(command.getAttachments() != null
            ? command.getAttachments() : objectMapper.createArrayNode());
        message.setMetadata(command.getMetadata() != null
            ? command.getMetadata() : objectMapper.createObjectNode());
        message.setPlatformMessageId(command.getPlatformMessageId());
        message.setAiGenerated(command.isAiGenerated());
        message.setAiConfidenceScore(command.getAiConfidenceScore());
        message.setStatus(initialStatus);
        stampTimestamps(message, initialStatus, null, now);

        Message saved = messageRepository.saveAndFlush(message);
        applyToConversation(conversation, saved);
        conversationRepository.save(conversation);

        metricsService.recordMessageCreated(saved.getDirection());
        log.info("Created {} {} message {} in conversation {}", saved.getDirection(), saved.getMessageType(),
            saved.getId(), conversation.getId());
        return saved;
    }

    static void validateContent(CreateMessageCommand command) {
        MessageType type = command.getMessageType();
        if (type == MessageType.TEXT) {
            if (command.getContent() == null || command.getContent().isBlank()) {
                throw new BadRequestException("Text messages require content");
            }
        } else if (command.getMediaUrl() == null || command.getMediaUrl().isBlank()) {
            throw new BadRequestException(type + " messages require a media URL");
        }
    }

    /**
     * Overwrites the preview only if the message is not older than the current one, so an
     * out-of-order create never regresses it.
     */
    static void applyToConversation(Conversation conversation, Message message) {
        LocalDateTime messageAt = message.getCreatedAt() != null ? message.getCreatedAt() : LocalDateTime.now();
        LocalDateTime lastAt = conversation.getLastMessageAt();
        if (lastAt != null && messageAt.isBefore(lastAt)) {
            log.debug("Message {} is older than conversation {} preview; preview kept",
                message.getId(), conversation.getId());
        } else {
            SenderType senderType = message.getSenderType();
            conversation.setLastMessageAt(messageAt);
            conversation.setLastMessageById(message.getSenderId());
            conversation.setLastMessageByType(senderType);
            conversation.setLastMessageByName(senderType.getDisplayName());
            conversation.setLastMessageContent(truncate(message.getContent(), PREVIEW_MAX_LENGTH));
            conversation.setLastMessageType(message.getMessageType());
            conversation.setLastMessageMediaUrl(message.getMediaUrl());
        }

        if (message.getSenderType().isHuman() && isAfter(messageAt, conversation.getLastHumanMessageAt())) {
            conversation.setLastHumanMessageAt(messageAt);
        }
        if ((message.getSenderType() == SenderType.AI || Boolean.TRUE.equals(message.getAiGenerated()))
                && isAfter(messageAt, conversation.getLastAiMessageAt())) {
            conversation.setLastAiMessageAt(messageAt);
        }
    }

    private static boolean isAfter(LocalDateTime candidate, LocalDateTime current) {
        return current == null || !candidate.isBefore(current);
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        // Do not split a surrogate pair
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * Applies a delivery status callback.
     *
     * <p>Duplicate and stale callbacks are normal: the same status is a no-op, and a
     * backwards or out-of-lifecycle change is ignored and logged.
     *
     * @throws ResourceNotFoundException if the message does not exist
     */
    public StatusUpdateResult updateStatus(UUID messageId, MessageStatus newStatus, String failureReason) {
        if (newStatus == null) {
            throw new BadRequestException("status is required");
        }
        return transactionTemplate.execute(tx -> {
            Message message = messageRepository.findByIdForUpdate(messageId)
                .orElseThrow(() -> ResourceNotFoundException.of("Message", messageId));
            MessageStatus current = message.getStatus();

            if (current == newStatus) {
                log.debug("Message {} already {}", messageId, newStatus);
                return StatusUpdateResult.UNCHANGED;
            }
            if (!statusTransitionValidator.isValidTransition(current, newStatus)) {
                log.warn("Ignoring status update for message {}: {} → {}", messageId, current, newStatus);
                return StatusUpdateResult.REJECTED;
            }

            message.setStatus(newStatus);
            stampTimestamps(message, newStatus, failureReason, LocalDateTime.now());
            messageRepository.save(message);
            log.info("Message {} status {} → {}", messageId, current, newStatus);
            return StatusUpdateResult.APPLIED;
        });
    }

    private static void stampTimestamps(Message message, MessageStatus status, String failureReason, LocalDateTime now) {
        switch (status) {
            case DELIVERED:
                if (message.getDeliveredAt() == null) {
                    message.setDeliveredAt(now);
                }
                break;
            case READ:
                // A read receipt can overtake the delivery receipt
                if (message.getDeliveredAt() == null) {
                    message.setDeliveredAt(now);
                }
                if (message.getReadAt() == null) {
                    message.setReadAt(now);
                }
                break;
            case FAILED:
                if (message.getFailedAt() == null) {
                    message.setFailedAt(now);
                }
                message.setFailureReason(failureReason == null || failureReason.isBlank()
                    ? DEFAULT_FAILURE_REASON : failureReason);
                break;
            default:
                break;
        }
    }

    public Message getMessage(UUID messageId) {
        return messageRepository.findById(messageId)
            .orElseThrow(() -> ResourceNotFoundException.of("Message", messageId));
    }

    /**
     * Stores an AI reply as a pending outbound message and hands it to the delivery worker.
     *
     * <p>A redelivered response event finds the message it created the first time and only
     * republishes the delivery event, under the same event id.
     *
     * @throws com.clapgrow.inbox.api.event.EventPublishException if the delivery event could not be published; the
     *                               message stays stored
     */
    public Message handleAiResponse(AiResponseEvent event) {
        if (event.getConversationId() == null || event.getOrganizationId() == null) {
            throw new BadRequestException("AI response " + event.getEventId() + " has no conversation or organization");
        }

        ObjectNode metadata = objectMapper.createObjectNode();
        if (event.getEventId() != null) {
            metadata.put(AI_RESPONSE_EVENT_KEY, event.getEventId().toString());
        }
        if (event.getReplyToMessageId() != null) {
            metadata.put("reply_to_message_id", event.getReplyToMessageId().toString());
        }
        // Keyed on the event id: the unique platform id index collapses redeliveries, concurrent ones included
        Message message = createMessage(CreateMessageCommand.builder()
            .conversationId(event.getConversationId())
            .organizationId(event.getOrganizationId())
            .direction(MessageDirection.OUTBOUND)
            .senderType(SenderType.AI)
            .messageType(MessageType.TEXT)
            .content(event.getContent())
            .metadata(metadata)
            .platformMessageId(aiPlatformMessageId(event))
            .initialStatus(MessageStatus.PENDING)
            .aiGenerated(true)
            .aiConfidenceScore(event.getConfidenceScore())
            .build());

        Conversation conversation = conversationRepository.findById(message.getConversationId())
            .orElseThrow(() -> ResourceNotFoundException.of("Conversation", event.getConversationId()));

        MessageDeliveryEvent delivery = MessageDeliveryEvent.builder()
            .eventId(MessageDeliveryEvent.eventIdFor(message.getId()))
            .messageId(message.getId())
            .conversationId(conversation.getId())
            .organizationId(conversation.getOrganizationId())
            .contactId(conversation.getContactId())
            .mediumId(conversation.getMedium().getCode())
            .messageType(message.getMessageType())
            .content(message.getContent())
            .mediaUrl(message.getMediaUrl())
            .createdAt(LocalDateTime.now())
            .build();
        eventPublisher.publish(properties.getEvents().getTopics().getMessageDelivery(), delivery);
        return message;
    }

    static String aiPlatformMessageId(AiResponseEvent event) {
        return event.getEventId() != null ? AI_PLATFORM_ID_PREFIX + event.getEventId() : null;
    }
}
