package com.clapgrow.inbox.api.listener;

import com.clapgrow.inbox.api.config.JacksonConfig;
import com.clapgrow.inbox.api.service.MessageLifecycleService;
import com.clapgrow.inbox.api.service.ProcessedEventService;
import com.clapgrow.inbox.api.service.ResourceNotFoundException;
import com.clapgrow.inbox.api.service.StatusUpdateResult;
import com.clapgrow.inbox.common.enums.MessageStatus;
import com.clapgrow.inbox.common.event.MessageStatusEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryStatusListenerTest {

    @Mock
    private ProcessedEventService processedEventService;

    @Mock
    private MessageLifecycleService messageLifecycleService;

    @Mock
    private Acknowledgment acknowledgment;

    private final ObjectMapper objectMapper = JacksonConfig.configure(new ObjectMapper());
    private DeliveryStatusListener listener;

    @BeforeEach
    void setUp() {
        listener = new DeliveryStatusListener(objectMapper, processedEventService, messageLifecycleService);
    }

    private String payload(UUID eventId, UUID messageId, String status) throws Exception {
        return objectMapper.writeValueAsString(MessageStatusEvent.builder()
            .eventId(eventId)
            .organizationId(UUID.randomUUID())
            .messageId(messageId)
            .status(status)
            .build());
    }

    @Test
    void testOnStatus_WhenNewEvent_AppliesMarksAndAcks() throws Exception {
        UUID eventId = UUID.randomUUID();
        UUID messageId = UUID.randomUUID();
        when(messageLifecycleService.updateStatus(messageId, MessageStatus.DELIVERED, null))
            .thenReturn(StatusUpdateResult.APPLIED);

        listener.onStatus(payload(eventId, messageId, "2"), messageId.toString(), acknowledgment);

        verify(processedEventService).markProcessed(eventId, DeliveryStatusListener.CONSUMER);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void testOnStatus_WhenAlreadyProcessed_AcksWithoutApplying() throws Exception {
        UUID eventId = UUID.randomUUID();
        when(processedEventService.isProcessed(eventId, DeliveryStatusListener.CONSUMER)).thenReturn(true);

        listener.onStatus(payload(eventId, UUID.randomUUID(), "read"), null, acknowledgment);

        verifyNoInteractions(messageLifecycleService);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void testOnStatus_WhenStatusUnknown_DropsAndAcks() throws Exception {
        UUID eventId = UUID.randomUUID();

        listener.onStatus(payload(eventId, UUID.randomUUID(), "bounced"), null, acknowledgment);

        verifyNoInteractions(messageLifecycleService);
        verify(processedEventService).markProcessed(eventId, DeliveryStatusListener.CONSUMER);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void testOnStatus_WhenMessageMissing_DropsAndAcks() throws Exception {
        UUID messageId = UUID.randomUUID();
        when(messageLifecycleService.updateStatus(any(), any(), any()))
            .thenThrow(ResourceNotFoundException.of("Message", messageId));

        listener.onStatus(payload(UUID.randomUUID(), messageId, "sent"), null, acknowledgment);

        verify(acknowledgment).acknowledge();
    }

    @Test
    void testOnStatus_WhenTransientFailure_PropagatesWithoutAck() throws Exception {
        when(messageLifecycleService.updateStatus(any(), any(), any()))
            .thenThrow(new org.springframework.dao.QueryTimeoutException("db slow"));

        String payload = payload(UUID.randomUUID(), UUID.randomUUID(), "sent");
        assertThrows(org.springframework.dao.QueryTimeoutException.class,
            () -> listener.onStatus(payload, null, acknowledgment));

        verify(acknowledgment, never()).acknowledge();
        verify(processedEventService, never()).markProcessed(any(), any());
    }

    @Test
    void testOnStatus_WhenPayloadUnreadable_AcksAndSkips() {
        listener.onStatus("{not json", "k", acknowledgment);

        verify(acknowledgment).acknowledge();
        verifyNoInteractions(processedEventService, messageLifecycleService);
    }
}
