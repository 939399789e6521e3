package com.clapgrow.inbox.common.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Delivery callback relayed by a delivery worker.
 *
 * <p>{@code status} is the raw wire value: either a numeric code ("2") or a name ("delivered").
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageStatusEvent implements DomainEvent {

    private UUID eventId;
    private UUID messageId;
    private UUID organizationId;
    private String status;
    private String failureReason;
    private LocalDateTime createdAt;

    @Override
    public String partitionKey() {
        return messageId != null ? messageId.toString() : DomainEvent.super.partitionKey();
    }
}
