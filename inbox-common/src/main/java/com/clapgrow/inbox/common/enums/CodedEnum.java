package com.clapgrow.inbox.common.enums;

/**
 * Enum with a stable integer wire/storage code.
 *
 * <p>Codes are part of the database and event contract, so they must never be
 * derived from {@code ordinal()}.
 */
public interface CodedEnum {

    int getCode();

    /**
     * Looks up an enum constant by its code.
     *
     * @throws IllegalArgumentException if no constant carries the code
     */
    static <E extends Enum<E> & CodedEnum> E fromCode(Class<E> type, int code) {
        for (E constant : type.getEnumConstants()) {
            if (constant.getCode() == code) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " code: " + code);
    }
}
