package com.clapgrow.inbox.api.config;

import com.clapgrow.inbox.common.kafka.KafkaConsumerConfigHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

import java.util.Map;

/**
 * Consumer side of the pipeline.
 *
 * <p>Listeners acknowledge only after their work committed. A listener that throws
 * leaves the record unacknowledged; the error handler re-seeks it a few times and
 * then logs and skips it, so one poison record cannot stall a partition.
 */
@Configuration
@Slf4j
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${kafka.consumer.group-id:inbox-pipeline}")
    private String baseGroupId;

    @Value("${kafka.consumer.environment-prefix:}")
    private String environmentPrefix;

    @Value("${kafka.consumer.concurrency:3}")
    private int concurrency;

    @Value("${kafka.consumer.max-poll-records:10}")
    private int maxPollRecords;

    @Value("${kafka.consumer.retry-interval-ms:1000}")
    private long retryIntervalMs;

    @Value("${kafka.consumer.retry-attempts:3}")
    private long retryAttempts;

    @Bean
    public ConsumerFactory<String, String> consumerFactory() {
        String groupId = KafkaConsumerConfigHelper.buildGroupId(baseGroupId, environmentPrefix);
        Map<String, Object> configProps = KafkaConsumerConfigHelper.createBaseConsumerProperties(
            bootstrapServers, groupId, maxPollRecords);
        return new DefaultKafkaConsumerFactory<>(configProps);
    }

    @Bean
    public DefaultErrorHandler kafkaErrorHandler() {
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(
            (record, exception) -> log.error("Giving up on record topic={} partition={} offset={} key={}",
                record.topic(), record.partition(), record.offset(), record.key(), exception),
            new FixedBackOff(retryIntervalMs, retryAttempts));
        // Manual acks: let the handler commit the offset of a skipped record
        errorHandler.setAckAfterHandle(true);
        return errorHandler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
            new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory());
        factory.setConcurrency(concurrency);
        factory.setCommonErrorHandler(kafkaErrorHandler());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        return factory;
    }
}
