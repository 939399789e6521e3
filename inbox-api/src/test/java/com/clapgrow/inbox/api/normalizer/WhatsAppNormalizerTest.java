package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WhatsAppNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WhatsAppNormalizer normalizer = new WhatsAppNormalizer();

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw.replace('\'', '"'));
    }

    @Test
    void testExtract_WhenTextMessage_ReturnsCanonicalText() throws Exception {
        JsonNode payload = json("{'entry':[{'changes':[{'value':{'messages':[" +
            "{'from':'6281234567890','id':'wamid.1','timestamp':'1700000000','type':'text','text':{'body':'hello'}}" +
            "]}}]}]}");

        List<CanonicalMessage> messages = normalizer.extract(payload);

        assertEquals(1, messages.size());
        CanonicalMessage message = messages.get(0);
        assertEquals("6281234567890", message.getOriginId());
        assertEquals("hello", message.getContent());
        assertEquals(MessageType.TEXT, message.getMessageType());
        assertEquals("", message.getMediaUrl());
        assertEquals("wamid.1", message.getPlatformMessageId());
        assertEquals("wamid.1", message.getMetadata().get("whatsapp_message_id"));
        assertEquals("1700000000", message.getMetadata().get("timestamp"));
    }

    @Test
    void testExtract_WhenOneUnitMalformed_KeepsWellFormedUnit() throws Exception {
        JsonNode payload = json("{'entry':[{'changes':[{'value':{'messages':[" +
            "{'from':12345,'id':'wamid.bad','text':{'body':'numeric sender'}}," +
            "{'from':'628111','id':'wamid.good','text':{'body':'ok'}}" +
            "]}}]}]}");

        List<CanonicalMessage> messages = normalizer.extract(payload);

        assertEquals(1, messages.size());
        assertEquals("wamid.good", messages.get(0).getPlatformMessageId());
    }

    @Test
    void testExtract_WhenImageWithCaption_UsesMediaIdAndCaption() throws Exception {
        JsonNode payload = json("{'entry':[{'changes':[{'value':{'messages':[" +
            "{'from':'628111','id':'wamid.2','type':'image','image':{'id':'media-9','caption':'receipt'}}" +
            "]}}]}]}");

        CanonicalMessage message = normalizer.extract(payload).get(0);

        assertEquals(MessageType.IMAGE, message.getMessageType());
        assertEquals("media-9", message.getMediaUrl());
        assertEquals("receipt", message.getContent());
    }

    @Test
    void testExtract_WhenDocument_UsesFilenameAsContent() throws Exception {
        JsonNode payload = json("{'entry':[{'changes':[{'value':{'messages':[" +
            "{'from':'628111','id':'wamid.3','document':{'id':'doc-1','filename':'invoice.pdf'}}" +
            "]}}]}]}");

        CanonicalMessage message = normalizer.extract(payload).get(0);

        assertEquals(MessageType.DOCUMENT, message.getMessageType());
        assertEquals("doc-1", message.getMediaUrl());
        assertEquals("invoice.pdf", message.getContent());
    }

    @Test
    void testExtract_WhenUnsupportedTypeOrStatusCallback_ReturnsEmpty() throws Exception {
        JsonNode payload = json("{'entry':[{'changes':[" +
            "{'value':{'statuses':[{'id':'wamid.1','status':'read'}]}}," +
            "{'value':{'messages':[{'from':'628111','id':'wamid.4','type':'reaction','reaction':{'emoji':'+1'}}]}}" +
            "]}]}");

        assertTrue(normalizer.extract(payload).isEmpty());
    }

    @Test
    void testValidate_WhenEntryMissingOrEmpty_Throws() throws Exception {
        PayloadValidationException missing = assertThrows(PayloadValidationException.class,
            () -> normalizer.validate(json("{'object':'whatsapp_business_account'}")));
        assertTrue(missing.getMessage().contains("missing 'entry' field"));

        PayloadValidationException notArray = assertThrows(PayloadValidationException.class,
            () -> normalizer.validate(json("{'entry':{}}")));
        assertTrue(notArray.getMessage().contains("must be an array"));

        PayloadValidationException empty = assertThrows(PayloadValidationException.class,
            () -> normalizer.validate(json("{'entry':[]}")));
        assertTrue(empty.getMessage().contains("array is empty"));

        assertThrows(PayloadValidationException.class, () -> normalizer.validate(json("{}")));
    }

    @Test
    void testMedium_ReturnsWhatsApp() {
        assertEquals(Medium.WHATSAPP, normalizer.medium());
    }
}
