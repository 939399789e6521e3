package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageType;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Facebook Messenger. Adds file attachments and stickers on top of the Instagram shapes;
 * a sticker arrives as an image attachment plus a {@code sticker_id} on the message.
 */
@Component
public class FacebookNormalizer extends AbstractMessengerNormalizer {

    @Override
    public Medium medium() {
        return Medium.FACEBOOK;
    }

    @Override
    protected String metadataPrefix() {
        return "facebook";
    }

    @Override
    protected MessageType attachmentType(String type) {
        if (type == null) {
            return null;
        }
        switch (type) {
            case "image":
                return MessageType.IMAGE;
            case "video":
                return MessageType.VIDEO;
            case "audio":
                return MessageType.AUDIO;
            case "file":
                return MessageType.DOCUMENT;
            case "sticker":
                return MessageType.STICKER;
            default:
                return null;
        }
    }

    @Override
    protected MessageType specialMessageType(JsonNode message) {
        return message.hasNonNull("sticker_id") ? MessageType.STICKER : null;
    }
}
