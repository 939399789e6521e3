package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Meta Messenger-platform webhooks (Instagram Direct, Facebook Messenger).
 *
 * <p>Both deliver {@code entry[].messaging[]} units with a {@code sender.id} and a
 * {@code message} object holding either {@code text} or {@code attachments}. They
 * differ in the metadata key prefix and in which attachment types they send.
 */
@Slf4j
public abstract class AbstractMessengerNormalizer implements PlatformNormalizer {

    /**
     * Prefix for platform-qualified metadata keys, e.g. "instagram" gives
     * {@code instagram_sender_id}.
     */
    protected abstract String metadataPrefix();

    /**
     * Maps an attachment {@code type} to a message type; null for types this platform
     * does not send.
     */
    protected abstract MessageType attachmentType(String type);

    /**
     * Hook for platform-specific message shapes that have no attachment type, such as
     * Messenger stickers. Returns null when not applicable.
     */
    protected MessageType specialMessageType(JsonNode message) {
        return null;
    }

    @Override
    public void validate(JsonNode payload) {
        if (payload == null || !JsonFields.isNonEmptyArray(payload, "entry")) {
            throw new PayloadValidationException("invalid " + medium().getTag() + " payload: missing entry");
        }
    }

    @Override
    public List<CanonicalMessage> extract(JsonNode payload) {
        validate(payload);

        List<CanonicalMessage> messages = new ArrayList<>();
        for (JsonNode entry : payload.get("entry")) {
            for (JsonNode messaging : JsonFields.array(entry, "messaging")) {
                CanonicalMessage message = extractSingle(messaging);
                if (message != null) {
                    messages.add(message);
                }
            }
        }
        return messages;
    }

    private CanonicalMessage extractSingle(JsonNode messaging) {
        String senderId = JsonFields.text(JsonFields.object(messaging, "sender"), "id");
        JsonNode message = JsonFields.object(messaging, "message");
        if (senderId == null || message == null) {
            // Read receipts, reactions and postbacks arrive without a message object
            log.warn("Skipping {} messaging unit without sender id or message object", medium().getTag());
            return null;
        }

        MessageType type = MessageType.TEXT;
        String content = "";
        String mediaUrl = "";

        if (message.has("text")) {
            content = JsonFields.textOrEmpty(message, "text");
        } else {
            Iterator<JsonNode> attachments = JsonFields.array(message, "attachments").iterator();
            if (attachments.hasNext()) {
                JsonNode attachment = attachments.next();
                MessageType mapped = attachmentType(JsonFields.text(attachment, "type"));
                if (mapped != null) {
                    type = mapped;
                }
                mediaUrl = JsonFields.textOrEmpty(JsonFields.object(attachment, "payload"), "url");
            }
            MessageType special = specialMessageType(message);
            if (special != null) {
                type = special;
            }
        }

        String mid = JsonFields.text(message, "mid");
        if (!PlatformNormalizer.hasUsableContent(type, content, mediaUrl)) {
            log.warn("Skipping {} message {} with no supported content", medium().getTag(), mid);
            return null;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(metadataPrefix() + "_sender_id", senderId);
        if (mid != null) {
            metadata.put(metadataPrefix() + "_message_id", mid);
        }
        JsonFields.putTimestamp(messaging, metadata);

        return CanonicalMessage.builder()
            .originId(senderId)
            .content(content)
            .mediaUrl(mediaUrl)
            .messageType(type)
            .metadata(metadata)
            .platformMessageId(mid)
            .build();
    }
}
