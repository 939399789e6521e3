package com.clapgrow.inbox.common.event;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Common envelope contract for everything published on the inbox topics.
 *
 * <p>{@code eventId} is the consumer-side deduplication key; publishers that can be
 * re-run (redelivered ingestion, retried webhooks) derive it deterministically so a
 * replay produces the same id.
 */
public interface DomainEvent {

    UUID getEventId();

    UUID getOrganizationId();

    LocalDateTime getCreatedAt();

    /**
     * Kafka record key. Defaults to the organization; conversation-scoped events
     * override it so all events of a conversation stay ordered on one partition.
     */
    default String partitionKey() {
        return getOrganizationId() != null ? getOrganizationId().toString() : null;
    }
}
