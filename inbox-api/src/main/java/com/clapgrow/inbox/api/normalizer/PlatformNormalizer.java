package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Turns one platform's webhook payload into canonical messages.
 *
 * <p>Implementations are pure functions of the payload: no persistence, no messaging,
 * no clock. A structurally invalid envelope fails the whole payload; a malformed
 * inner unit is skipped and the rest of the batch is kept.
 */
public interface PlatformNormalizer {

    Medium medium();

    /**
     * @throws PayloadValidationException if the envelope cannot be processed at all
     */
    void validate(JsonNode payload);

    /**
     * Validates, then extracts every well-formed message in delivery order.
     *
     * @throws PayloadValidationException if the envelope cannot be processed at all
     */
    List<CanonicalMessage> extract(JsonNode payload);

    /**
     * Text needs non-blank content and media needs a media reference; a unit
     * without either is skipped rather than stored as an empty message.
     */
    static boolean hasUsableContent(MessageType type, String content, String mediaUrl) {
        return type.isMedia() ? mediaUrl != null && !mediaUrl.isEmpty() : content != null && !content.isBlank();
    }
}
