package com.clapgrow.inbox.common.enums;

import java.util.Locale;

/**
 * Delivery lifecycle of a message.
 *
 * <p>Codes double as the wire format used by delivery callbacks:
 * {@code pending=0, sent=1, delivered=2, read=3, failed=4}.
 * PENDING, SENT, DELIVERED and READ are ordered by code; FAILED sits outside
 * that order and is only reachable before delivery.
 */
public enum MessageStatus implements CodedEnum {
    PENDING(0),
    SENT(1),
    DELIVERED(2),
    READ(3),
    FAILED(4);

    private final int code;

    MessageStatus(int code) {
        this.code = code;
    }

    @Override
    public int getCode() {
        return code;
    }

    public static MessageStatus fromCode(int code) {
        return CodedEnum.fromCode(MessageStatus.class, code);
    }

    /**
     * Parses either a numeric wire code ("2") or a case-insensitive name ("delivered").
     *
     * @throws IllegalArgumentException if the value matches neither form
     */
    public static MessageStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Message status must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(trimmed));
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown message status: " + value, e);
        }
    }
}
