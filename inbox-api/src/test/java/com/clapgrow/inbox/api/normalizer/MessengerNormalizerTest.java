package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessengerNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InstagramNormalizer instagram = new InstagramNormalizer();
    private final FacebookNormalizer facebook = new FacebookNormalizer();

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw.replace('\'', '"'));
    }

    @Test
    void testInstagramExtract_WhenReadReceiptMixedWithText_KeepsTextOnly() throws Exception {
        JsonNode payload = json("{'entry':[{'messaging':[" +
            "{'sender':{'id':'ig-1'},'read':{'mid':'m0'}}," +
            "{'sender':{'id':'ig-1'},'timestamp':1700000000123,'message':{'mid':'m1','text':'hi there'}}" +
            "]}]}");

        List<CanonicalMessage> messages = instagram.extract(payload);

        assertEquals(1, messages.size());
        CanonicalMessage message = messages.get(0);
        assertEquals("ig-1", message.getOriginId());
        assertEquals("hi there", message.getContent());
        assertEquals("m1", message.getPlatformMessageId());
        assertEquals("ig-1", message.getMetadata().get("instagram_sender_id"));
        assertEquals("m1", message.getMetadata().get("instagram_message_id"));
        assertEquals(1700000000123L, message.getMetadata().get("timestamp"));
    }

    @Test
    void testInstagramExtract_WhenImageAttachment_ReturnsImage() throws Exception {
        JsonNode payload = json("{'entry':[{'messaging':[" +
            "{'sender':{'id':'ig-2'},'message':{'mid':'m2','attachments':[{'type':'image','payload':{'url':'https://cdn/x.jpg'}}]}}" +
            "]}]}");

        CanonicalMessage message = instagram.extract(payload).get(0);

        assertEquals(MessageType.IMAGE, message.getMessageType());
        assertEquals("https://cdn/x.jpg", message.getMediaUrl());
    }

    @Test
    void testInstagramExtract_WhenFileAttachment_SkipsUnit() throws Exception {
        // Instagram does not send files; the unit falls back to TEXT without content
        JsonNode payload = json("{'entry':[{'messaging':[" +
            "{'sender':{'id':'ig-3'},'message':{'mid':'m3','attachments':[{'type':'file','payload':{'url':'https://cdn/a.pdf'}}]}}" +
            "]}]}");

        assertTrue(instagram.extract(payload).isEmpty());
    }

    @Test
    void testFacebookExtract_WhenFileAttachment_ReturnsDocument() throws Exception {
        JsonNode payload = json("{'entry':[{'messaging':[" +
            "{'sender':{'id':'fb-1'},'message':{'mid':'f1','attachments':[{'type':'file','payload':{'url':'https://cdn/a.pdf'}}]}}" +
            "]}]}");

        CanonicalMessage message = facebook.extract(payload).get(0);

        assertEquals(MessageType.DOCUMENT, message.getMessageType());
        assertEquals("https://cdn/a.pdf", message.getMediaUrl());
        assertEquals("fb-1", message.getMetadata().get("facebook_sender_id"));
    }

    @Test
    void testFacebookExtract_WhenStickerId_ReturnsSticker() throws Exception {
        JsonNode payload = json("{'entry':[{'messaging':[" +
            "{'sender':{'id':'fb-2'},'message':{'mid':'f2','sticker_id':369239263222822," +
            "'attachments':[{'type':'image','payload':{'url':'https://cdn/like.png'}}]}}" +
            "]}]}");

        CanonicalMessage message = facebook.extract(payload).get(0);

        assertEquals(MessageType.STICKER, message.getMessageType());
        assertEquals("https://cdn/like.png", message.getMediaUrl());
    }

    @Test
    void testFacebookExtract_WhenSenderMissing_KeepsOtherUnits() throws Exception {
        JsonNode payload = json("{'entry':[{'messaging':[" +
            "{'message':{'mid':'f3','text':'orphan'}}," +
            "{'sender':{'id':'fb-3'},'message':{'mid':'f4','text':'kept'}}" +
            "]}]}");

        List<CanonicalMessage> messages = facebook.extract(payload);

        assertEquals(1, messages.size());
        assertEquals("kept", messages.get(0).getContent());
    }

    @Test
    void testValidate_WhenEntryMissing_ThrowsWithPlatformTag() throws Exception {
        PayloadValidationException e = assertThrows(PayloadValidationException.class,
            () -> facebook.validate(json("{'object':'page'}")));
        assertEquals("invalid facebook payload: missing entry", e.getMessage());

        assertThrows(PayloadValidationException.class, () -> instagram.validate(json("{'entry':[]}")));
    }
}
