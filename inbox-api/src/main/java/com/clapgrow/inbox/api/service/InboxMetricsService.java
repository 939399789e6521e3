package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.common.enums.Medium;
import com.clapgrow.inbox.common.enums.MessageDirection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus metrics for the inbox pipeline, exposed at /actuator/prometheus.
 *
 * <p>Per-medium counters are created once at startup. Webhooks for platforms we do not
 * support are counted under {@code platform=unsupported} so arbitrary path segments
 * cannot explode tag cardinality.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboxMetricsService {

    static final String UNSUPPORTED = "unsupported";

    private final MeterRegistry meterRegistry;

    private final Map<String, Counter> webhookReceivedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> webhookProcessedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> webhookFailedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> webhookRetriedCounters = new ConcurrentHashMap<>();
    private final Map<MessageDirection, Counter> messageCreatedCounters = new EnumMap<>(MessageDirection.class);
    private final Map<String, Timer> publishTimers = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        for (Medium medium : Medium.values()) {
            registerPlatform(medium.getTag());
        }
        registerPlatform(UNSUPPORTED);
        for (MessageDirection direction : MessageDirection.values()) {
            messageCreatedCounters.put(direction, Counter.builder("inbox.messages.created")
                .description("Messages stored, excluding idempotent replays")
                .tag("direction", direction.name())
                .register(meterRegistry));
        }
        log.info("Initialized inbox metrics for {} platforms", Medium.values().length);
    }

    private void registerPlatform(String platform) {
        webhookReceivedCounters.put(platform, Counter.builder("inbox.webhooks.received")
            .description("Webhook deliveries persisted")
            .tag("platform", platform)
            .register(meterRegistry));
        webhookProcessedCounters.put(platform, Counter.builder("inbox.webhooks.processed")
            .description("Webhook deliveries normalized and forwarded")
            .tag("platform", platform)
            .register(meterRegistry));
        webhookFailedCounters.put(platform, Counter.builder("inbox.webhooks.failed")
            .description("Webhook deliveries marked FAILED")
            .tag("platform", platform)
            .register(meterRegistry));
        webhookRetriedCounters.put(platform, Counter.builder("inbox.webhooks.retried")
            .description("Transient webhook processing failures scheduled for retry")
            .tag("platform", platform)
            .register(meterRegistry));
    }

    public void recordWebhookReceived(String platform) {
        counterFor(webhookReceivedCounters, platform).increment();
    }

    public void recordWebhookProcessed(String platform) {
        counterFor(webhookProcessedCounters, platform).increment();
    }

    public void recordWebhookFailed(String platform) {
        counterFor(webhookFailedCounters, platform).increment();
    }

    public void recordWebhookRetried(String platform) {
        counterFor(webhookRetriedCounters, platform).increment();
    }

    public void recordMessageCreated(MessageDirection direction) {
        Counter counter = messageCreatedCounters.get(direction);
        if (counter != null) {
            counter.increment();
        }
    }

    public Timer.Sample startPublishTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopPublishTimer(Timer.Sample sample, String topic, boolean success) {
        Timer timer = publishTimers.computeIfAbsent(topic + ":" + success, key -> Timer.builder("inbox.events.publish.latency")
            .description("Time to get a broker ack for an event")
            .tag("topic", topic)
            .tag("outcome", success ? "success" : "failure")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry));
        sample.stop(timer);
    }

    private Counter counterFor(Map<String, Counter> counters, String platform) {
        String tag = Medium.fromTag(platform).map(Medium::getTag).orElse(UNSUPPORTED);
        return counters.get(tag);
    }
}
