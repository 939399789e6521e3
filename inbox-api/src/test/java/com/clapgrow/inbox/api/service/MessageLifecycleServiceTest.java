package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.api.config.InboxProperties;
import com.clapgrow.inbox.api.entity.Conversation;
import com.clapgrow.inbox.api.entity.Message;
import com.clapgrow.inbox.api.event.EventPublisher;
import com.clapgrow.inbox.api.repository.ConversationRepository;
import com.clapgrow.inbox.api.repository.MessageRepository;
import com.clapgrow.inbox.api.support.ImmediateTransactionManager;
import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageDirection;
import com.clapgrow.inbox.common.enums.MessageStatus;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.enums.SenderType;
import com.clapgrow.inbox.common.event.AiResponseEvent;
import com.clapgrow.inbox.common.event.MessageDeliveryEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageLifecycleServiceTest {

    @Mock
    private MessageRepository messageRepository;

    @Mock
    private ConversationRepository conversationRepository;

    @Mock
    private EventPublisher eventPublisher;

    @Mock
    private InboxMetricsService metricsService;

    private MessageLifecycleService service;
    private Conversation conversation;
    private final UUID organizationId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new MessageLifecycleService(messageRepository, conversationRepository,
            new StatusTransitionValidator(), eventPublisher, new InboxProperties(), metricsService,
            new ObjectMapper(), ImmediateTransactionManager.transactionTemplate());

        conversation = new Conversation();
        conversation.setId(UUID.randomUUID());
        conversation.setOrganizationId(organizationId);
        conversation.setContactId(UUID.randomUUID());
        conversation.setMedium(Medium.WHATSAPP);

        lenient().when(conversationRepository.findByIdForUpdate(conversation.getId())).thenReturn(Optional.of(conversation));
        lenient().when(conversationRepository.findById(conversation.getId())).thenReturn(Optional.of(conversation));
        lenient().when(messageRepository.saveAndFlush(any(Message.class))).thenAnswer(invocation -> {
            Message message = invocation.getArgument(0);
            message.setId(UUID.randomUUID());
            return message;
        });
    }

    private CreateMessageCommand.CreateMessageCommandBuilder inboundText(String content) {
        return CreateMessageCommand.builder()
            .conversationId(conversation.getId())
            .organizationId(organizationId)
            .direction(MessageDirection.INBOUND)
            .senderType(SenderType.CUSTOMER)
            .senderId(conversation.getContactId())
            .messageType(MessageType.TEXT)
            .content(content)
            .initialStatus(MessageStatus.DELIVERED);
    }

    @Test
    void testCreateMessage_WhenInbound_UpdatesHumanPreviewOnly() {
        Message message = service.createMessage(inboundText("hello").platformMessageId("wamid.1").build());

        assertEquals(MessageStatus.DELIVERED, message.getStatus());
        assertNotNull(message.getDeliveredAt());
        assertTrue(message.getAttachments().isArray());
        assertEquals("hello", conversation.getLastMessageContent());
        assertEquals(SenderType.CUSTOMER, conversation.getLastMessageByType());
        assertEquals("Customer", conversation.getLastMessageByName());
        assertEquals(MessageType.TEXT, conversation.getLastMessageType());
        assertNotNull(conversation.getLastHumanMessageAt());
        assertNull(conversation.getLastAiMessageAt());
        verify(conversationRepository).save(conversation);
        verify(metricsService).recordMessageCreated(MessageDirection.INBOUND);
    }

    @Test
    void testCreateMessage_WhenPlatformIdSeenBefore_ReturnsExistingWithoutSaving() {
        Message existing = new Message();
        existing.setId(UUID.randomUUID());
        when(messageRepository.findByConversationIdAndPlatformMessageId(conversation.getId(), "wamid.1"))
            .thenReturn(Optional.of(existing));

        Message result = service.createMessage(inboundText("hello").platformMessageId("wamid.1").build());

        assertSame(existing, result);
        verify(messageRepository, never()).saveAndFlush(any());
        verify(conversationRepository, never()).save(any());
    }

    @Test
    void testCreateMessage_WhenConcurrentDuplicate_ReturnsWinner() {
        Message winner = new Message();
        winner.setId(UUID.randomUUID());
        when(messageRepository.findByConversationIdAndPlatformMessageId(conversation.getId(), "wamid.2"))
            .thenReturn(Optional.empty(), Optional.of(winner));
        doThrow(new DataIntegrityViolationException("uq_messages_platform_id"))
            .when(messageRepository).saveAndFlush(any(Message.class));

        Message result = service.createMessage(inboundText("hi").platformMessageId("wamid.2").build());

        assertSame(winner, result);
    }

    @Test
    void testCreateMessage_WhenConversationInOtherOrganization_ThrowsNotFound() {
        CreateMessageCommand command = inboundText("hello").organizationId(UUID.randomUUID()).build();

        assertThrows(ResourceNotFoundException.class, () -> service.createMessage(command));
    }

    @Test
    void testCreateMessage_WhenTextWithoutContent_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> service.createMessage(inboundText("  ").build()));
    }

    @Test
    void testCreateMessage_WhenMediaWithoutUrl_ThrowsBadRequest() {
        CreateMessageCommand command = inboundText("caption").messageType(MessageType.IMAGE).build();

        assertThrows(BadRequestException.class, () -> service.createMessage(command));
    }

    @Test
    void testCreateMessage_WhenRequiredFieldsMissing_ThrowsBadRequest() {
        CreateMessageCommand command = inboundText("hello").direction(null).build();

        assertThrows(BadRequestException.class, () -> service.createMessage(command));
        verifyNoInteractions(conversationRepository);
    }

    @Test
    void testApplyToConversation_WhenOlderMessage_KeepsNewerPreview() {
        LocalDateTime newer = LocalDateTime.now();
        conversation.setLastMessageAt(newer);
        conversation.setLastMessageContent("latest");

        Message late = new Message();
        late.setSenderType(SenderType.AGENT);
        late.setMessageType(MessageType.TEXT);
        late.setContent("stale");
        late.setCreatedAt(newer.minusMinutes(5));
        MessageLifecycleService.applyToConversation(conversation, late);

        assertEquals("latest", conversation.getLastMessageContent());
        assertEquals(newer, conversation.getLastMessageAt());
    }

    @Test
    void testApplyToConversation_WhenAiMessage_SetsLastAiOnly() {
        Message reply = new Message();
        reply.setSenderType(SenderType.AI);
        reply.setMessageType(MessageType.TEXT);
        reply.setContent("How can I help?");
        reply.setAiGenerated(true);

        MessageLifecycleService.applyToConversation(conversation, reply);

        assertNotNull(conversation.getLastAiMessageAt());
        assertNull(conversation.getLastHumanMessageAt());
        assertEquals("AI Assistant", conversation.getLastMessageByName());
    }

    @Test
    void testTruncate_WhenLongOrSurrogatePair_CutsSafely() {
        assertEquals(255, MessageLifecycleService.truncate("a".repeat(300), 255).length());
        assertEquals("short", MessageLifecycleService.truncate("short", 255));
        assertNull(MessageLifecycleService.truncate(null, 255));

        String emoji = "ab😀";
        assertEquals("ab", MessageLifecycleService.truncate(emoji, 3));
    }

    @Test
    void testUpdateStatus_WhenDeliveredTwice_SecondIsUnchanged() {
        Message message = storedMessage(MessageStatus.SENT);

        assertEquals(StatusUpdateResult.APPLIED, service.updateStatus(message.getId(), MessageStatus.DELIVERED, null));
        LocalDateTime deliveredAt = message.getDeliveredAt();
        assertNotNull(deliveredAt);

        assertEquals(StatusUpdateResult.UNCHANGED, service.updateStatus(message.getId(), MessageStatus.DELIVERED, null));
        assertEquals(deliveredAt, message.getDeliveredAt());
        verify(messageRepository, times(1)).save(message);
    }

    @Test
    void testUpdateStatus_WhenFailed_SetsFailedAtAndReasonOnly() {
        Message message = storedMessage(MessageStatus.SENT);

        StatusUpdateResult result = service.updateStatus(message.getId(), MessageStatus.FAILED, "  ");

        assertEquals(StatusUpdateResult.APPLIED, result);
        assertNotNull(message.getFailedAt());
        assertEquals("Unknown failure", message.getFailureReason());
        assertNull(message.getDeliveredAt());
        assertNull(message.getReadAt());
    }

    @Test
    void testUpdateStatus_WhenReadBeforeDelivered_StampsBoth() {
        Message message = storedMessage(MessageStatus.PENDING);

        service.updateStatus(message.getId(), MessageStatus.READ, null);

        assertNotNull(message.getDeliveredAt());
        assertNotNull(message.getReadAt());
        assertEquals(MessageStatus.READ, message.getStatus());
    }

    @Test
    void testUpdateStatus_WhenBackward_IsRejected() {
        Message message = storedMessage(MessageStatus.READ);

        StatusUpdateResult result = service.updateStatus(message.getId(), MessageStatus.SENT, null);

        assertEquals(StatusUpdateResult.REJECTED, result);
        assertEquals(MessageStatus.READ, message.getStatus());
        verify(messageRepository, never()).save(any());
    }

    @Test
    void testUpdateStatus_WhenMessageMissing_ThrowsNotFound() {
        UUID id = UUID.randomUUID();
        when(messageRepository.findByIdForUpdate(id)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.updateStatus(id, MessageStatus.SENT, null));
    }

    @Test
    void testHandleAiResponse_WhenNew_CreatesOutboundAndPublishesDelivery() {
        AiResponseEvent event = AiResponseEvent.builder()
            .eventId(UUID.randomUUID())
            .organizationId(organizationId)
            .conversationId(conversation.getId())
            .replyToMessageId(UUID.randomUUID())
            .content("Your order ships tomorrow.")
            .confidenceScore(0.92)
            .createdAt(LocalDateTime.now())
            .build();

        Message message = service.handleAiResponse(event);

        assertEquals(MessageDirection.OUTBOUND, message.getDirection());
        assertEquals(SenderType.AI, message.getSenderType());
        assertEquals(MessageStatus.PENDING, message.getStatus());
        assertTrue(message.getAiGenerated());
        assertEquals(0.92, message.getAiConfidenceScore(), 1e-9);
        assertEquals("ai:" + event.getEventId(), message.getPlatformMessageId());
        assertEquals(event.getEventId().toString(), message.getMetadata().get("ai_response_event_id").asText());
        assertNotNull(conversation.getLastAiMessageAt());

        ArgumentCaptor<MessageDeliveryEvent> captor = ArgumentCaptor.forClass(MessageDeliveryEvent.class);
        verify(eventPublisher).publish(eq("message-delivery"), captor.capture());
        MessageDeliveryEvent delivery = captor.getValue();
        assertEquals(message.getId(), delivery.getMessageId());
        assertEquals(MessageDeliveryEvent.eventIdFor(message.getId()), delivery.getEventId());
        assertEquals(conversation.getContactId(), delivery.getContactId());
        assertEquals(Medium.WHATSAPP.getCode(), delivery.getMediumId());
    }

    @Test
    void testHandleAiResponse_WhenRedelivered_RepublishesWithoutCreating() {
        Message stored = new Message();
        stored.setId(UUID.randomUUID());
        stored.setConversationId(conversation.getId());
        stored.setMessageType(MessageType.TEXT);
        stored.setContent("Already answered");
        UUID eventId = UUID.randomUUID();
        when(messageRepository.findByConversationIdAndPlatformMessageId(conversation.getId(), "ai:" + eventId))
            .thenReturn(Optional.of(stored));

        AiResponseEvent event = AiResponseEvent.builder()
            .eventId(eventId)
            .organizationId(organizationId)
            .conversationId(conversation.getId())
            .content("Already answered")
            .build();
        Message result = service.handleAiResponse(event);

        assertSame(stored, result);
        verify(messageRepository, never()).saveAndFlush(any());
        verify(eventPublisher).publish(anyString(), any(MessageDeliveryEvent.class));
    }

    @Test
    void testHandleAiResponse_WhenConcurrentRedeliveryWinsInsert_ReturnsWinnerAndStoresOnce() {
        UUID eventId = UUID.randomUUID();
        Message winner = new Message();
        winner.setId(UUID.randomUUID());
        winner.setConversationId(conversation.getId());
        winner.setMessageType(MessageType.TEXT);
        winner.setContent("Your order ships tomorrow.");
        // Both deliveries miss the lookup; the second insert then hits the unique platform id index
        when(messageRepository.findByConversationIdAndPlatformMessageId(conversation.getId(), "ai:" + eventId))
            .thenReturn(Optional.empty(), Optional.of(winner));
        doThrow(new DataIntegrityViolationException("uq_messages_platform_id"))
            .when(messageRepository).saveAndFlush(any(Message.class));

        AiResponseEvent event = AiResponseEvent.builder()
            .eventId(eventId)
            .organizationId(organizationId)
            .conversationId(conversation.getId())
            .content("Your order ships tomorrow.")
            .build();
        Message result = service.handleAiResponse(event);

        assertSame(winner, result);
        verify(conversationRepository, never()).save(any());
        ArgumentCaptor<MessageDeliveryEvent> captor = ArgumentCaptor.forClass(MessageDeliveryEvent.class);
        verify(eventPublisher).publish(eq("message-delivery"), captor.capture());
        assertEquals(MessageDeliveryEvent.eventIdFor(winner.getId()), captor.getValue().getEventId());
    }

    private Message storedMessage(MessageStatus status) {
        Message message = new Message();
        message.setId(UUID.randomUUID());
        message.setConversationId(conversation.getId());
        message.setStatus(status);
        when(messageRepository.findByIdForUpdate(message.getId())).thenReturn(Optional.of(message));
        return message;
    }
}
