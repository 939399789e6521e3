package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageType;
import org.springframework.stereotype.Component;

@Component
public class InstagramNormalizer extends AbstractMessengerNormalizer {

    @Override
    public Medium medium() {
        return Medium.INSTAGRAM;
    }

    @Override
    protected String metadataPrefix() {
        return "instagram";
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
            default:
                return null;
        }
    }
}
