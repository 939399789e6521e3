package com.clapgrow.inbox.api.enums;

/**
 * Lifecycle of a stored webhook delivery.
 *
 * <p>PENDING → PROCESSED or PENDING → FAILED. PROCESSED and FAILED are terminal.
 */
public enum WebhookEventStatus {
    PENDING,
    PROCESSED,
    FAILED
}
