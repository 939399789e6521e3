package com.clapgrow.inbox.common.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Messaging platform a conversation lives on.
 *
 * <p>The tag is the lowercase path segment used by webhook URLs
 * ({@code /api/v1/webhooks/whatsapp}); the code is the persisted {@code medium_id}.
 */
public enum Medium implements CodedEnum {
    WHATSAPP(1, "whatsapp"),
    INSTAGRAM(2, "instagram"),
    FACEBOOK(3, "facebook"),
    EMAIL(4, "email");

    private final int code;
    private final String tag;

    Medium(int code, String tag) {
        this.code = code;
        this.tag = tag;
    }

    @Override
    public int getCode() {
        return code;
    }

    public String getTag() {
        return tag;
    }

    public static Medium fromCode(int code) {
        return CodedEnum.fromCode(Medium.class, code);
    }

    /**
     * Resolves a platform tag case-insensitively. Unknown or blank tags yield empty.
     */
    public static Optional<Medium> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Medium medium : values()) {
            if (medium.tag.equals(normalized)) {
                return Optional.of(medium);
            }
        }
        return Optional.empty();
    }
}
