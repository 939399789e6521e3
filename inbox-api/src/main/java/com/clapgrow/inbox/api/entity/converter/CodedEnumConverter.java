package com.clapgrow.inbox.api.entity.converter;

import com.clapgrow.inbox.common.enums.CodedEnum;
import jakarta.persistence.AttributeConverter;

/**
 * Persists a {@link CodedEnum} as its integer code, never as its ordinal or name.
 */
public abstract class CodedEnumConverter<E extends Enum<E> & CodedEnum> implements AttributeConverter<E, Integer> {

    private final Class<E> type;

    protected CodedEnumConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public Integer convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public E convertToEntityAttribute(Integer dbData) {
        return dbData == null ? null : CodedEnum.fromCode(type, dbData);
    }
}
