package com.clapgrow.inbox.api.entity.converter;

import com.clapgrow.inbox.common.enums.MessageType;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class MessageTypeConverter extends CodedEnumConverter<MessageType> {

    public MessageTypeConverter() {
        super(MessageType.class);
    }
}
