package com.clapgrow.inbox.api.entity.converter;

import com.clapgrow.inbox.common.enums.SenderType;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SenderTypeConverter extends CodedEnumConverter<SenderType> {

    public SenderTypeConverter() {
        super(SenderType.class);
    }
}
