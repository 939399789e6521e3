package com.clapgrow.inbox.api.event;

import com.clapgrow.inbox.api.config.InboxProperties;
import com.clapgrow.inbox.api.service.InboxMetricsService;
import com.clapgrow.inbox.common.event.DomainEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes events as JSON strings keyed by {@link DomainEvent#partitionKey()}, so all
 * events of one conversation land on the same partition in order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KafkaEventPublisher implements EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final InboxProperties properties;
    private final InboxMetricsService metricsService;

    @Override
    public void publish(String topic, DomainEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventPublishException("Failed to serialize " + event.getClass().getSimpleName()
                + " " + event.getEventId(), e);
        }

        Duration timeout = properties.getEvents().getPublishTimeout();
        Timer.Sample sample = metricsService.startPublishTimer();
        boolean success = false;
        try {
            kafkaTemplate.send(topic, event.partitionKey(), payload)
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            success = true;
            log.debug("Published {} {} to topic {}", event.getClass().getSimpleName(), event.getEventId(), topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing event " + event.getEventId() + " to " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Kafka rejected event {} for topic {}: {}", event.getEventId(), topic, cause.getMessage());
            throw new EventPublishException("Failed to publish event " + event.getEventId() + " to " + topic, cause);
        } catch (TimeoutException e) {
            log.error("Timed out after {} publishing event {} to topic {}", timeout, event.getEventId(), topic);
            throw new EventPublishException("Timed out publishing event " + event.getEventId() + " to " + topic, e);
        } catch (org.apache.kafka.common.KafkaException | org.springframework.kafka.KafkaException e) {
            log.error("Kafka send failed for event {} on topic {}: {}", event.getEventId(), topic, e.getMessage());
            throw new EventPublishException("Failed to publish event " + event.getEventId() + " to " + topic, e);
        } finally {
            metricsService.stopPublishTimer(sample, topic, success);
        }
    }
}
