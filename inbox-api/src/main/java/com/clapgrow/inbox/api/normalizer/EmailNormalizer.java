package com.clapgrow.inbox.api.normalizer;

import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageType;
import com.clapgrow.inbox.common.model.CanonicalMessage;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inbound-parse style email webhooks (SendGrid, Mailgun and similar).
 *
 * <p>Field names vary by provider, so sender and body are taken from the first field
 * present in a fixed preference order. Subject and body are folded into one text
 * message: {@code "Subject: <subject>\n\n<body>"}.
 */
@Component
@Slf4j
public class EmailNormalizer implements PlatformNormalizer {

    private static final String[] SENDER_FIELDS = {"email", "from", "sender"};
    private static final String[] BODY_FIELDS = {"text", "body", "message"};

    @Override
    public Medium medium() {
        return Medium.EMAIL;
    }

    @Override
    public void validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new PayloadValidationException("invalid email payload: expected a JSON object");
        }
        if (!payload.has("email") && !payload.has("from") && !payload.has("emails")) {
            throw new PayloadValidationException("invalid email payload: missing email or from field");
        }
    }

    @Override
    public List<CanonicalMessage> extract(JsonNode payload) {
        validate(payload);

        List<CanonicalMessage> messages = new ArrayList<>();
        JsonNode batch = payload.get("emails");
        if (batch != null && batch.isArray()) {
            for (JsonNode email : batch) {
                if (!email.isObject()) {
                    log.warn("Skipping non-object entry in email batch");
                    continue;
                }
                CanonicalMessage message = extractSingle(email);
                if (message != null) {
                    messages.add(message);
                }
            }
        } else {
            CanonicalMessage message = extractSingle(payload);
            if (message != null) {
                messages.add(message);
            }
        }
        return messages;
    }

    private CanonicalMessage extractSingle(JsonNode email) {
        String from = firstText(email, SENDER_FIELDS);
        if (from == null) {
            log.warn("Skipping email without sender address");
            return null;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();

        String subject = JsonFields.textOrEmpty(email, "subject");
        if (JsonFields.text(email, "subject") != null) {
            metadata.put("subject", subject);
        }

        String body = firstText(email, BODY_FIELDS);
        if (body == null) {
            body = JsonFields.text(email, "html");
            if (body != null) {
                metadata.put("content_type", "html");
            }
        }
        if (body == null) {
            body = "";
        }

        String content = composeContent(subject, body);
        if (content.isBlank()) {
            log.warn("Skipping email from {} with neither subject nor body", from);
            return null;
        }

        String messageId = JsonFields.text(email, "message_id");
        if (messageId != null) {
            metadata.put("email_message_id", messageId);
        }
        JsonFields.putTimestamp(email, metadata);
        String to = JsonFields.text(email, "to");
        if (to != null) {
            metadata.put("to", to);
        }

        return CanonicalMessage.builder()
            .originId(from)
            .content(content)
            .mediaUrl("")
            .messageType(MessageType.TEXT)
            .metadata(metadata)
            .platformMessageId(messageId)
            .build();
    }

    static String composeContent(String subject, String body) {
        if (!subject.isEmpty() && !body.isEmpty()) {
            return "Subject: " + subject + "\n\n" + body;
        }
        if (!subject.isEmpty()) {
            return subject;
        }
        return body;
    }

    private static String firstText(JsonNode node, String[] fields) {
        for (String field : fields) {
            String value = JsonFields.text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
