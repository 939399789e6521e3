package com.clapgrow.inbox.common.enums;

public enum MessageType implements CodedEnum {
    TEXT(1),
    IMAGE(2),
    VIDEO(3),
    AUDIO(4),
    DOCUMENT(5),
    STICKER(6);

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    @Override
    public int getCode() {
        return code;
    }

    /**
     * Every non-text type carries its payload behind a media URL (or platform media id).
     */
    public boolean isMedia() {
        return this != TEXT;
    }

    public static MessageType fromCode(int code) {
        return CodedEnum.fromCode(MessageType.class, code);
    }
}
