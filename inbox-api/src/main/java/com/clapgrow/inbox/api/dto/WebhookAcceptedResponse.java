package com.clapgrow.inbox.api.dto;

import com.clapgrow.inbox.api.enums.WebhookEventStatus;

import java.util.UUID;

public record WebhookAcceptedResponse(
    UUID eventId,
    WebhookEventStatus status,
    String errorMessage
) {
}
