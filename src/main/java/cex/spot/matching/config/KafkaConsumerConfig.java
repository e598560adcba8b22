package cex.spot.matching.config;

import cex.spot.matching.event.OrderCommandEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka Consumer Configuration
 * Configures the consumer of order commands (PLACE / CANCEL) from the order-input topic
 */
@Configuration
@EnableKafka
@ConditionalOnProperty(name = "matching.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id:spot-matching-engine}")
    private String groupId;

    @Value("${matching.kafka.consumer.concurrency:3}")
    private int concurrency;

    /**
     * Base consumer configuration
     */
    @Bean
    public Map<String, Object> consumerConfigs() {
        Map<String, Object> props = new HashMap<>();

        // Connection
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);

        // Deserialization (value deserializer is set programmatically in ConsumerFactory)
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class);

        // Consumer group settings
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false); // Manual commit after the engine returns
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000); // 5 minutes

        // Reliability
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000); // 30 seconds
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000); // 10 seconds

        return props;
    }

    /**
     * Consumer factory for OrderCommandEvent
     */
    @Bean
    public ConsumerFactory<String, OrderCommandEvent> orderCommandConsumerFactory() {
        JsonDeserializer<OrderCommandEvent> deserializer = new JsonDeserializer<>(OrderCommandEvent.class, false);
        deserializer.addTrustedPackages("cex.spot.matching.event");

        return new DefaultKafkaConsumerFactory<>(
            consumerConfigs(),
            new StringDeserializer(),
            deserializer
        );
    }

    /**
     * Listener container factory for OrderCommandEvent
     * Used by OrderCommandConsumer
     * - Commands are keyed by symbol, so one partition never interleaves two consumers on a symbol
     * - Manual acknowledgment once the engine call returns
     * - Retry 3 times with 1 second backoff, then log and skip
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, OrderCommandEvent> orderCommandListenerContainerFactory() {

        ConcurrentKafkaListenerContainerFactory<String, OrderCommandEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(orderCommandConsumerFactory());
        factory.setConcurrency(concurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(
            new FixedBackOff(1000L, 3L) // 1 second interval, 3 retry attempts
        );
        factory.setCommonErrorHandler(errorHandler);

        return factory;
    }
}
