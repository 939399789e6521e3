package com.clapgrow.inbox.common.model;

import com.clapgrow.inbox.common.enums.MessageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Platform-independent view of one inbound message, produced by a normalizer.
 *
 * <p>{@code originId} is whatever the platform identifies the sender by: a phone
 * number (WhatsApp), a page-scoped user id (Instagram, Facebook) or an email address.
 * {@code mediaUrl} is never null; it is the empty string for text messages. For
 * WhatsApp it holds the media id, which the delivery side resolves to a download URL.
 *
 * <p>Metadata keys are platform-qualified ({@code whatsapp_message_id},
 * {@code instagram_sender_id}, ...) so they can be merged into message metadata
 * without collisions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalMessage {

    private String originId;

    @Builder.Default
    private String content = "";

    @Builder.Default
    private String mediaUrl = "";

    @Builder.Default
    private MessageType messageType = MessageType.TEXT;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Platform-native id (wamid, mid, Message-ID). Null when the platform sent none.
     */
    private String platformMessageId;
}
