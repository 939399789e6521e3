package com.clapgrow.inbox.api.dto;

import com.clapgrow.inbox.api.service.StatusUpdateResult;
import com.clapgrow.inbox.common.enums.MessageStatus;

import java.util.UUID;

public record MessageStatusUpdateResponse(
    UUID messageId,
    MessageStatus status,
    StatusUpdateResult result
) {
}
