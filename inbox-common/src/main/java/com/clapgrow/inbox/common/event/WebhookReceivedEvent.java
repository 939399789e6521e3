package com.clapgrow.inbox.common.event;

import com.clapgrow.inbox.common.model.CanonicalMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Normalized content of one webhook delivery, handed from intake to ingestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookReceivedEvent implements DomainEvent {

    private UUID eventId;
    private UUID webhookEventId;
    private UUID organizationId;
    private int mediumId;
    private String platform;

    @Builder.Default
    private List<CanonicalMessage> messages = new ArrayList<>();

    private LocalDateTime createdAt;

    /**
     * One event id per stored webhook, so a retried intake republishes under the same id.
     */
    public static UUID eventIdFor(UUID webhookEventId) {
        return UUID.nameUUIDFromBytes(("webhook-received:" + webhookEventId).getBytes(StandardCharsets.UTF_8));
    }
}
