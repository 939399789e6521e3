package com.clapgrow.inbox.api.entity.converter;

import com.clapgrow.inbox.common.enums.Medium;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class MediumConverter extends CodedEnumConverter<Medium> {

    public MediumConverter() {
        super(Medium.class);
    }
}
