package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmailNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EmailNormalizer normalizer = new EmailNormalizer();

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw.replace('\'', '"'));
    }

    @Test
    void testExtract_WhenSubjectAndBody_ComposesContent() throws Exception {
        JsonNode payload = json("{'from':'jane@example.com','subject':'Order status'," +
            "'body':'Where is my order?','message_id':'<abc@mail>'}");

        List<CanonicalMessage> messages = normalizer.extract(payload);

        assertEquals(1, messages.size());
        CanonicalMessage message = messages.get(0);
        assertEquals("jane@example.com", message.getOriginId());
        assertEquals("Subject: Order status\n\nWhere is my order?", message.getContent());
        assertEquals(MessageType.TEXT, message.getMessageType());
        assertEquals("<abc@mail>", message.getPlatformMessageId());
        assertEquals("Order status", message.getMetadata().get("subject"));
    }

    @Test
    void testExtract_WhenOnlyHtmlBody_MarksContentType() throws Exception {
        JsonNode payload = json("{'email':'jane@example.com','html':'<p>Hi</p>'}");

        CanonicalMessage message = normalizer.extract(payload).get(0);

        assertEquals("<p>Hi</p>", message.getContent());
        assertEquals("html", message.getMetadata().get("content_type"));
    }

    @Test
    void testExtract_WhenBatchHasMalformedEntry_KeepsWellFormed() throws Exception {
        JsonNode payload = json("{'emails':[" +
            "{'subject':'no sender'}," +
            "'not-an-object'," +
            "{'from':'a@example.com','text':'first'}," +
            "{'from':'b@example.com'}" +
            "]}");

        List<CanonicalMessage> messages = normalizer.extract(payload);

        assertEquals(1, messages.size());
        assertEquals("a@example.com", messages.get(0).getOriginId());
        assertEquals("first", messages.get(0).getContent());
    }

    @Test
    void testComposeContent_WhenSubjectOrBodyMissing_ReturnsTheOther() {
        assertEquals("Only subject", EmailNormalizer.composeContent("Only subject", ""));
        assertEquals("Only body", EmailNormalizer.composeContent("", "Only body"));
        assertEquals("", EmailNormalizer.composeContent("", ""));
    }

    @Test
    void testValidate_WhenNoSenderFields_Throws() throws Exception {
        assertThrows(PayloadValidationException.class, () -> normalizer.validate(json("{'subject':'x'}")));
        assertThrows(PayloadValidationException.class, () -> normalizer.validate(json("[]")));
    }
}
