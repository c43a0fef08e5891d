package com.kotsin.stdev.config;

import com.kotsin.stdev.batch.ResultSink;
import com.kotsin.stdev.batch.SnapshotSource;
import com.kotsin.stdev.infrastructure.kafka.KafkaResultPublisher;
import com.kotsin.stdev.infrastructure.kafka.KafkaSnapshotSource;
import com.kotsin.stdev.model.Snapshot;
import com.kotsin.stdev.model.StdevResult;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring for the snapshot input and the result output. Both sides are off by default.
 */
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${stdev.input.kafka.group-id:rolling-stdev-loader}")
    private String consumerGroupId;

    // ==================== INPUT ====================

    @Bean
    @ConditionalOnProperty(name = "stdev.input.kafka.enabled", havingValue = "true")
    public ConsumerFactory<String, Snapshot> snapshotConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroupId);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1000);

        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), Snapshot.serde().deserializer());
    }

    @Bean
    @ConditionalOnProperty(name = "stdev.input.kafka.enabled", havingValue = "true")
    public SnapshotSource kafkaSnapshotSource(ConsumerFactory<String, Snapshot> snapshotConsumerFactory,
                                              StdevProperties properties) {
        return new KafkaSnapshotSource(
            snapshotConsumerFactory::createConsumer,
            properties.getInput().getKafka().getTopic(),
            ProcessingConstants.KAFKA_POLL_TIMEOUT,
            ProcessingConstants.MAX_EMPTY_POLLS);
    }

    // ==================== OUTPUT ====================

    @Bean
    @ConditionalOnProperty(name = "stdev.output.kafka.enabled", havingValue = "true")
    public ProducerFactory<String, StdevResult> stdevResultProducerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        return new DefaultKafkaProducerFactory<>(configProps, new StringSerializer(), StdevResult.serde().serializer());
    }

    @Bean
    @ConditionalOnProperty(name = "stdev.output.kafka.enabled", havingValue = "true")
    public KafkaTemplate<String, StdevResult> stdevResultKafkaTemplate(
            ProducerFactory<String, StdevResult> stdevResultProducerFactory) {
        return new KafkaTemplate<>(stdevResultProducerFactory);
    }

    @Bean
    @ConditionalOnProperty(name = "stdev.output.kafka.enabled", havingValue = "true")
    public ResultSink kafkaResultPublisher(KafkaTemplate<String, StdevResult> stdevResultKafkaTemplate,
                                           StdevProperties properties) {
        return new KafkaResultPublisher(
            stdevResultKafkaTemplate,
            properties.getOutput().getKafka().getTopic(),
            ProcessingConstants.PUBLISH_TIMEOUT);
    }
}
