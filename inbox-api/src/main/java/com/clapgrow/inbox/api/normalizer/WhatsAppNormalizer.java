package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WhatsApp Business (Cloud API) webhooks.
 *
 * <p>Messages live under {@code entry[].changes[].value.messages[]}. Media messages
 * carry a media id rather than a URL; the id is stored as the media URL and resolved
 * to a download link by the delivery side.
 */
@Component
@Slf4j
public class WhatsAppNormalizer implements PlatformNormalizer {

    @Override
    public Medium medium() {
        return Medium.WHATSAPP;
    }

    @Override
    public void validate(JsonNode payload) {
        if (payload == null || !payload.isObject() || payload.isEmpty()) {
            throw new PayloadValidationException("empty WhatsApp payload");
        }
        JsonNode entry = payload.get("entry");
        if (entry == null) {
            throw new PayloadValidationException("invalid WhatsApp payload: missing 'entry' field");
        }
        if (!entry.isArray()) {
            throw new PayloadValidationException("invalid WhatsApp payload: 'entry' must be an array");
        }
        if (entry.isEmpty()) {
            throw new PayloadValidationException("invalid WhatsApp payload: 'entry' array is empty");
        }
    }

    @Override
    public List<CanonicalMessage> extract(JsonNode payload) {
        validate(payload);

        List<CanonicalMessage> messages = new ArrayList<>();
        for (JsonNode entry : payload.get("entry")) {
            for (JsonNode change : JsonFields.array(entry, "changes")) {
                JsonNode value = JsonFields.object(change, "value");
                // Status callbacks share the envelope but carry no "messages"
                for (JsonNode unit : JsonFields.array(value, "messages")) {
                    CanonicalMessage message = extractSingle(unit);
                    if (message != null) {
                        messages.add(message);
                    }
                }
            }
        }
        return messages;
    }

    private CanonicalMessage extractSingle(JsonNode unit) {
        String from = JsonFields.text(unit, "from");
        String id = JsonFields.text(unit, "id");
        if (from == null || id == null) {
            log.warn("Skipping WhatsApp message without string 'from'/'id'");
            return null;
        }

        MessageType type = MessageType.TEXT;
        String content = "";
        String mediaUrl = "";

        JsonNode media;
        if (unit.has("text")) {
            content = JsonFields.textOrEmpty(JsonFields.object(unit, "text"), "body");
        } else if ((media = JsonFields.object(unit, "image")) != null) {
            type = MessageType.IMAGE;
            mediaUrl = JsonFields.textOrEmpty(media, "id");
            content = JsonFields.textOrEmpty(media, "caption");
        } else if ((media = JsonFields.object(unit, "video")) != null) {
            type = MessageType.VIDEO;
            mediaUrl = JsonFields.textOrEmpty(media, "id");
            content = JsonFields.textOrEmpty(media, "caption");
        } else if ((media = JsonFields.object(unit, "audio")) != null) {
            type = MessageType.AUDIO;
            mediaUrl = JsonFields.textOrEmpty(media, "id");
        } else if ((media = JsonFields.object(unit, "document")) != null) {
            type = MessageType.DOCUMENT;
            mediaUrl = JsonFields.textOrEmpty(media, "id");
            content = JsonFields.textOrEmpty(media, "filename");
        } else if ((media = JsonFields.object(unit, "sticker")) != null) {
            type = MessageType.STICKER;
            mediaUrl = JsonFields.textOrEmpty(media, "id");
        }

        if (!PlatformNormalizer.hasUsableContent(type, content, mediaUrl)) {
            log.warn("Skipping WhatsApp message {} with no supported content (type field: {})",
                id, JsonFields.text(unit, "type"));
            return null;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("whatsapp_message_id", id);
        JsonFields.putTimestamp(unit, metadata);

        return CanonicalMessage.builder()
            .originId(from)
            .content(content)
            .mediaUrl(mediaUrl)
            .messageType(type)
            .metadata(metadata)
            .platformMessageId(id)
            .build();
    }
}
