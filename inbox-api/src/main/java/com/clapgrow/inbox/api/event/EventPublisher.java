package com.clapgrow.inbox.api.event;

import com.clapgrow.inbox.common.event.DomainEvent;

/**
 * Hands domain events to downstream consumers.
 *
 * <p>Callers publish only after their state change committed and never roll that
 * state back when publishing fails.
 */
public interface EventPublisher {

    /**
     * Blocks until the broker acknowledged the event.
     *
     * @throws EventPublishException on serialization failure, broker error or timeout
     */
    void publish(String topic, DomainEvent event);
}
