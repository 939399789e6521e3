package com.clapgrow.inbox.api.entity;

import com.clapgrow.inbox.api.config.PostgreSQLJSONBType;
import com.clapgrow.inbox.api.enums.WebhookEventStatus;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Type;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One raw delivery received from a platform webhook.
 *
 * <p>Stored before any parsing so nothing a platform sends is lost. Only
 * {@code WebhookIntakeService} mutates these rows; they are never deleted.
 */
@Entity
@Table(name = "webhook_events", indexes = {
    @Index(name = "idx_webhook_events_status_retry", columnList = "status, retry_count, updated_at"),
    @Index(name = "idx_webhook_events_organization", columnList = "organization_id")
})
@Getter
@Setter
@NoArgsConstructor
public class WebhookEvent extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Column(name = "medium_id", nullable = false)
    private Integer mediumId;

    @Column(name = "platform", nullable = false, length = 50)
    private String platform;

    @Column(name = "payload", columnDefinition = "JSONB")
    @Type(PostgreSQLJSONBType.class)
    private JsonNode payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private WebhookEventStatus status = WebhookEventStatus.PENDING;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;
}
