package com.clapgrow.inbox.api.listener;

import com.clapgrow.inbox.api.service.BadRequestException;
import com.clapgrow.inbox.api.service.ProcessedEventService;
import com.clapgrow.inbox.api.service.ResourceNotFoundException;
import com.clapgrow.inbox.common.event.DomainEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.support.Acknowledgment;

/**
 * Shared handling for pipeline listeners: deserialize, skip already-handled events,
 * process, record, acknowledge.
 *
 * <p>Malformed records and permanently invalid events (unknown message, missing
 * content) are logged and acknowledged. Everything else propagates without an ack,
 * so the container's error handler redelivers the record.
 */
@Slf4j
public abstract class DeduplicatingEventListener<E extends DomainEvent> {

    private final ObjectMapper objectMapper;
    private final ProcessedEventService processedEventService;
    private final Class<E> eventType;

    protected DeduplicatingEventListener(ObjectMapper objectMapper,
                                         ProcessedEventService processedEventService,
                                         Class<E> eventType) {
        this.objectMapper = objectMapper;
        this.processedEventService = processedEventService;
        this.eventType = eventType;
    }

    /** Name recorded in the processed-events ledger. Unique per listener. */
    protected abstract String consumerName();

    protected abstract void process(E event);

    protected void handle(String payload, String key, Acknowledgment acknowledgment) {
        E event;
        try {
            event = objectMapper.readValue(payload, eventType);
        } catch (JsonProcessingException e) {
            log.error("{}: discarding undeserializable {} with key {}: {}", consumerName(),
                eventType.getSimpleName(), key, e.getOriginalMessage());
            acknowledgment.acknowledge();
            return;
        }

        if (event.getEventId() != null && processedEventService.isProcessed(event.getEventId(), consumerName())) {
            log.debug("{}: event {} already processed", consumerName(), event.getEventId());
            acknowledgment.acknowledge();
            return;
        }

        try {
            process(event);
        } catch (BadRequestException | ResourceNotFoundException e) {
            log.error("{}: dropping event {}: {}", consumerName(), event.getEventId(), e.getMessage());
        }

        if (event.getEventId() != null) {
            processedEventService.markProcessed(event.getEventId(), consumerName());
        }
        acknowledgment.acknowledge();
    }
}
