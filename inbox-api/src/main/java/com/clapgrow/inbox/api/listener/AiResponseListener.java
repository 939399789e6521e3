package com.clapgrow.inbox.api.listener;

import com.clapgrow.inbox.api.service.MessageLifecycleService;
import com.clapgrow.inbox.api.service.ProcessedEventService;
import com.clapgrow.inbox.common.event.AiResponseEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Brings AI replies back into the inbox as pending outbound messages.
 */
@Component
public class AiResponseListener extends DeduplicatingEventListener<AiResponseEvent> {

    static final String CONSUMER = "ai-response";

    private final MessageLifecycleService messageLifecycleService;

    public AiResponseListener(ObjectMapper objectMapper,
                              ProcessedEventService processedEventService,
                              MessageLifecycleService messageLifecycleService) {
        super(objectMapper, processedEventService, AiResponseEvent.class);
        this.messageLifecycleService = messageLifecycleService;
    }

    @KafkaListener(topics = "${inbox.events.topics.ai-response-received:ai-response-received}",
                   containerFactory = "kafkaListenerContainerFactory")
    public void onAiResponse(@Payload String payload,
                             @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key,
                             Acknowledgment acknowledgment) {
        handle(payload, key, acknowledgment);
    }

    @Override
    protected String consumerName() {
        return CONSUMER;
    }

    @Override
    protected void process(AiResponseEvent event) {
        messageLifecycleService.handleAiResponse(event);
    }
}
