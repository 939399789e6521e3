package com.clapgrow.inbox.api.integration;

import com.clapgrow.inbox.common.event.WebhookReceivedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Webhook in, message row out: intake, the webhook-received topic, ingestion and persistence.
 */
@DisplayName("Webhook pipeline")
class WebhookPipelineIT extends BaseIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("A WhatsApp text webhook becomes one inbound message, even when delivered twice")
    void testWhatsAppWebhook_WhenDeliveredTwice_StoresOneMessage() throws Exception {
        UUID organizationId = UUID.randomUUID();
        String wamid = "wamid." + UUID.randomUUID();
        String body = ("{'entry':[{'changes':[{'value':{'messages':[" +
            "{'from':'6281234567890','id':'" + wamid + "','timestamp':'1700000000','type':'text','text':{'body':'hello'}}" +
            "]}}]}]}").replace('\'', '"');

        ResponseEntity<Map> first = post("whatsapp", organizationId, body);
        ResponseEntity<Map> second = post("whatsapp", organizationId, body);
        assertEquals(HttpStatus.ACCEPTED, first.getStatusCode());
        assertEquals(HttpStatus.ACCEPTED, second.getStatusCode());

        UUID firstEventId = eventId(first);
        UUID secondEventId = eventId(second);
        waitUntil(() -> isIngested(firstEventId) && isIngested(secondEventId), TIMEOUT);

        assertEquals(1, countMessages(wamid));
        String content = jdbcTemplate.queryForObject(
            "SELECT content FROM messages WHERE platform_message_id = ?", String.class, wamid);
        assertEquals("hello", content);
        Integer contacts = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM contacts WHERE organization_id = ?", Integer.class, organizationId);
        assertEquals(1, contacts);
    }

    @Test
    @DisplayName("An envelope without entries is stored as FAILED and not forwarded")
    void testWhatsAppWebhook_WhenEnvelopeInvalid_StoresFailedEvent() {
        UUID organizationId = UUID.randomUUID();

        ResponseEntity<Map> response = post("whatsapp", organizationId, "{\"entry\":[]}");

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        Map<?, ?> data = (Map<?, ?>) response.getBody().get("data");
        assertEquals("FAILED", data.get("status"));
        String stored = jdbcTemplate.queryForObject(
            "SELECT error_message FROM webhook_events WHERE id = ?", String.class, UUID.fromString((String) data.get("eventId")));
        assertEquals(data.get("errorMessage"), stored);
    }

    private ResponseEntity<Map> post(String platform, UUID organizationId, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.postForEntity(
            "/api/v1/webhooks/" + platform + "?organizationId=" + organizationId,
            new HttpEntity<>(body, headers), Map.class);
    }

    private int countMessages(String platformMessageId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM messages WHERE platform_message_id = ?", Integer.class, platformMessageId);
        return count == null ? 0 : count;
    }

    private static UUID eventId(ResponseEntity<Map> response) {
        Map<?, ?> data = (Map<?, ?>) response.getBody().get("data");
        return UUID.fromString((String) data.get("eventId"));
    }

    private boolean isIngested(UUID webhookEventId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM processed_events WHERE event_id = ? AND consumer = 'webhook-ingestion'",
            Integer.class, WebhookReceivedEvent.eventIdFor(webhookEventId));
        return count != null && count > 0;
    }
}
