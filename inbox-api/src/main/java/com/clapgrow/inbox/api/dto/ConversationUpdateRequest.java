package com.clapgrow.inbox.api.dto;

import com.clapgrow.inbox.api.enums.ConversationPriority;
import com.clapgrow.inbox.api.enums.ConversationStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update. Null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationUpdateRequest {
    private ConversationStatus status;
    private ConversationPriority priority;
}
