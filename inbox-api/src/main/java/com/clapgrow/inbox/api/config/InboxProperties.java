package com.clapgrow.inbox.api.config;

import com.clapgrow.inbox.common.event.EventTopics;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tunables for the inbox pipeline, bound from {@code inbox.*}.
 */
@ConfigurationProperties(prefix = "inbox")
@Getter
@Setter
public class InboxProperties {

    private Webhook webhook = new Webhook();
    private Events events = new Events();
    private Pipeline pipeline = new Pipeline();

    @Getter
    @Setter
    public static class Webhook {
        /** Upper bound for payload extraction of a single delivery. */
        private Duration processingTimeout = Duration.ofSeconds(10);
        /** Transient failures tolerated before an event is marked FAILED. */
        private int maxRetries = 3;
        /** Minimum age of the last attempt before the scheduler retries an event. */
        private Duration retryDelay = Duration.ofMinutes(1);
        /**
         * Age after which a PENDING event that never completed a first attempt (the
         * instance died mid-intake) is picked up by the scheduler.
         */
        private Duration stalledAfter = Duration.ofMinutes(10);
        private int retryBatchSize = 50;
        /** Threads available to normalizers. */
        private int normalizerThreads = 4;
    }

    @Getter
    @Setter
    public static class Events {
        /** How long a publisher blocks waiting for the broker ack. */
        private Duration publishTimeout = Duration.ofSeconds(5);
        private Topics topics = new Topics();
    }

    @Getter
    @Setter
    public static class Topics {
        private String webhookReceived = EventTopics.WEBHOOK_RECEIVED;
        private String messageCreated = EventTopics.MESSAGE_CREATED;
        private String aiResponseReceived = EventTopics.AI_RESPONSE_RECEIVED;
        private String messageDelivery = EventTopics.MESSAGE_DELIVERY;
        private String messageStatus = EventTopics.MESSAGE_STATUS;
    }

    @Getter
    @Setter
    public static class Pipeline {
        /**
         * User that owns conversations started by inbound messages. Organizations
         * listed in {@link #organizationSystemUsers} use their own user instead.
         */
        private UUID systemUserId;
        private Map<UUID, UUID> organizationSystemUsers = new HashMap<>();
    }
}
