package com.clapgrow.inbox.api.config;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Producer side of the pipeline. Events are JSON strings keyed by conversation id.
 *
 * <p>Publishers wait at most {@code inbox.events.publish-timeout} for an ack, so the
 * producer's own blocking and delivery limits are derived from it: a send the caller
 * already reported as failed does not linger in the buffer for minutes.
 */
@Configuration
@RequiredArgsConstructor
public class KafkaConfig {

    static final String CLIENT_ID = "inbox-api-producer";

    private final InboxProperties properties;

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Bean
    public ProducerFactory<String, String> producerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        // Keeps per-conversation ordering intact across producer retries
        configProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, 0);

        int publishTimeoutMs = (int) Math.max(1000, properties.getEvents().getPublishTimeout().toMillis());
        // send() blocks on metadata while the broker is down; never longer than the caller waits
        configProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, publishTimeoutMs);
        configProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, publishTimeoutMs);
        // Must be >= linger.ms + request.timeout.ms
        configProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 2 * publishTimeoutMs);

        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate() {
        return new KafkaTemplate<>(producerFactory());
    }
}
