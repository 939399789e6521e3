package com.clapgrow.inbox.api.enums;

public enum ConversationStatus {
    OPEN,
    CLOSED,
    PENDING,
    RESOLVED
}
