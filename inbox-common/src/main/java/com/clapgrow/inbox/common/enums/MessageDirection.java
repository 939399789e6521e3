package com.clapgrow.inbox.common.enums;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
