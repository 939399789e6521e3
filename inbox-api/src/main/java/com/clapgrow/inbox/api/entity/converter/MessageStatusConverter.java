package com.clapgrow.inbox.api.entity.converter;

import com.clapgrow.inbox.common.enums.MessageStatus;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class MessageStatusConverter extends CodedEnumConverter<MessageStatus> {

    public MessageStatusConverter() {
        super(MessageStatus.class);
    }
}
