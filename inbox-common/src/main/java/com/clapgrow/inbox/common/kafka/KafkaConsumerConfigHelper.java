package com.clapgrow.inbox.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the consumer properties shared by every inbox pipeline listener.
 *
 * <p>Listeners acknowledge manually after their side effects commit, so auto-commit
 * is always off and a crashed consumer re-reads from the last acknowledged offset.
 *
 * <pre>{@code
 * String groupId = KafkaConsumerConfigHelper.buildGroupId("inbox-pipeline", "prod");
 * Map<String, Object> props = KafkaConsumerConfigHelper.createBaseConsumerProperties(
 *     bootstrapServers, groupId, 10);
 * }</pre>
 */
public final class KafkaConsumerConfigHelper {

    public static final int DEFAULT_MAX_POLL_RECORDS = 10;

    private KafkaConsumerConfigHelper() {
    }

    public static Map<String, Object> createBaseConsumerProperties(String bootstrapServers, String groupId) {
        return createBaseConsumerProperties(bootstrapServers, groupId, DEFAULT_MAX_POLL_RECORDS);
    }

    /**
     * @param bootstrapServers Kafka bootstrap servers
     * @param groupId          consumer group id, already environment-prefixed
     * @param maxPollRecords   records per poll; keep small, each record may open several transactions
     */
    public static Map<String, Object> createBaseConsumerProperties(String bootstrapServers,
                                                                   String groupId,
                                                                   int maxPollRecords) {
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            throw new IllegalArgumentException("Kafka bootstrap servers must be configured");
        }
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("Kafka consumer group id must be configured");
        }
        if (maxPollRecords < 1) {
            throw new IllegalArgumentException("maxPollRecords must be positive, got " + maxPollRecords);
        }

        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);

        // Envelopes are JSON strings; listeners deserialize with the shared ObjectMapper
        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxPollRecords);

        configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);
        configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000);
        configProps.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        configProps.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, 1);
        configProps.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, 500);

        configProps.put(
            ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG,
            "org.apache.kafka.clients.consumer.CooperativeStickyAssignor"
        );
        return configProps;
    }

    /**
     * Prefixes the group id with an environment name ("prod-inbox-pipeline").
     * A null or blank prefix leaves the base id unchanged.
     */
    public static String buildGroupId(String baseGroupId, String environmentPrefix) {
        if (environmentPrefix != null && !environmentPrefix.trim().isEmpty()) {
            return environmentPrefix.trim() + "-" + baseGroupId;
        }
        return baseGroupId;
    }
}
