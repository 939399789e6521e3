package com.clapgrow.inbox.api.listener;

import com.clapgrow.inbox.api.service.BadRequestException;
import com.clapgrow.inbox.api.service.MessageLifecycleService;
import com.clapgrow.inbox.api.service.ProcessedEventService;
import com.clapgrow.inbox.api.service.StatusUpdateResult;
import com.clapgrow.inbox.common.enums.MessageStatus;
import com.clapgrow.inbox.common.event.MessageStatusEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Applies delivery receipts relayed by the delivery workers.
 */
@Component
@Slf4j
public class DeliveryStatusListener extends DeduplicatingEventListener<MessageStatusEvent> {

    static final String CONSUMER = "delivery-status";

    private final MessageLifecycleService messageLifecycleService;

    public DeliveryStatusListener(ObjectMapper objectMapper,
                                  ProcessedEventService processedEventService,
                                  MessageLifecycleService messageLifecycleService) {
        super(objectMapper, processedEventService, MessageStatusEvent.class);
        this.messageLifecycleService = messageLifecycleService;
    }

    @KafkaListener(topics = "${inbox.events.topics.message-status:message-status}",
                   containerFactory = "kafkaListenerContainerFactory")
    public void onStatus(@Payload String payload,
                         @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key,
                         Acknowledgment acknowledgment) {
        handle(payload, key, acknowledgment);
    }

    @Override
    protected String consumerName() {
        return CONSUMER;
    }

    @Override
    protected void process(MessageStatusEvent event) {
        if (event.getMessageId() == null) {
            throw new BadRequestException("Status event " + event.getEventId() + " has no message id");
        }
        MessageStatus status;
        try {
            status = MessageStatus.parse(event.getStatus());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
        StatusUpdateResult result = messageLifecycleService.updateStatus(
            event.getMessageId(), status, event.getFailureReason());
        log.debug("Status {} for message {}: {}", status, event.getMessageId(), result);
    }
}
