package com.clapgrow.inbox.common.event;

/**
 * Default topic names. Deployments can override each one under {@code inbox.events.topics}.
 */
public final class EventTopics {

    public static final String WEBHOOK_RECEIVED = "webhook-received";
    public static final String MESSAGE_CREATED = "message-created";
    public static final String AI_RESPONSE_RECEIVED = "ai-response-received";
    public static final String MESSAGE_DELIVERY = "message-delivery";
    public static final String MESSAGE_STATUS = "message-status";

    private EventTopics() {
    }
}
