package com.clapgrow.inbox.api.enums;

public enum ConversationPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
