package com.clapgrow.inbox.api.listener;

import com.clapgrow.inbox.api.service.InboundMessageService;
import com.clapgrow.inbox.api.service.ProcessedEventService;
import com.clapgrow.inbox.common.event.WebhookReceivedEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Fans normalized webhook content out into contacts, conversations and messages.
 */
@Component
@Slf4j
public class WebhookReceivedListener extends DeduplicatingEventListener<WebhookReceivedEvent> {

    static final String CONSUMER = "webhook-ingestion";

    private final InboundMessageService inboundMessageService;

    public WebhookReceivedListener(ObjectMapper objectMapper,
                                   ProcessedEventService processedEventService,
                                   InboundMessageService inboundMessageService) {
        super(objectMapper, processedEventService, WebhookReceivedEvent.class);
        this.inboundMessageService = inboundMessageService;
    }

    @KafkaListener(topics = "${inbox.events.topics.webhook-received:webhook-received}",
                   containerFactory = "kafkaListenerContainerFactory")
    public void onWebhookReceived(@Payload String payload,
                                  @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key,
                                  Acknowledgment acknowledgment) {
        handle(payload, key, acknowledgment);
    }

    @Override
    protected String consumerName() {
        return CONSUMER;
    }

    @Override
    protected void process(WebhookReceivedEvent event) {
        log.debug("Ingesting webhook event {} with {} message(s)", event.getWebhookEventId(), event.getMessages().size());
        inboundMessageService.ingest(event);
    }
}
