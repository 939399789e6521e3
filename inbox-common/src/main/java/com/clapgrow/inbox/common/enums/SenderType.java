package com.clapgrow.inbox.common.enums;

/**
 * Who authored a message. The display name is what conversation previews show.
 */
public enum SenderType implements CodedEnum {
    CUSTOMER(1, "Customer"),
    AGENT(2, "Agent"),
    AI(3, "AI Assistant"),
    SYSTEM(4, "System");

    private final int code;
    private final String displayName;

    SenderType(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @Override
    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isHuman() {
        return this == CUSTOMER || this == AGENT;
    }

    public static SenderType fromCode(int code) {
        return CodedEnum.fromCode(SenderType.class, code);
    }
}
