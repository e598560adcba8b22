package cex.spot.matching.config;

import cex.spot.matching.event.OrderBookUpdatedEvent;
import cex.spot.matching.event.TradeExecutedEvent;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka Producer Configuration
 * Configures producers for publishing matching events to Kafka topics
 */
@Configuration
@ConditionalOnProperty(name = "matching.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    /**
     * Longest time send() may block on metadata or a full buffer.
     * Events are sent with the symbol lock held, so this bounds how long a broker outage stalls matching.
     */
    @Value("${matching.kafka.producer.max-block-ms:500}")
    private long maxBlockMs;

    /**
     * Base producer configuration
     * - acks=all, idempotence on: trades are the system of record for downstream settlement
     * - linger.ms=5 keeps book updates close to real time
     * - max.block.ms bounds send() while the symbol lock is held
     */
    @Bean
    public Map<String, Object> producerConfigs() {
        Map<String, Object> props = new HashMap<>();

        // Connection
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        // Serialization
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);

        // Batching
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, 16384); // 16KB batch size
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "snappy");

        // Reliability, per-symbol ordering is kept by the symbol key
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
        props.put(ProducerConfig.RETRIES_CONFIG, 3);

        // Timeouts
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000); // 30 seconds
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000); // 2 minutes
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        return props;
    }

    /**
     * Producer factory for TradeExecutedEvent
     */
    @Bean
    public ProducerFactory<String, TradeExecutedEvent> tradeEventProducerFactory() {
        return new DefaultKafkaProducerFactory<>(producerConfigs());
    }

    /**
     * KafkaTemplate for publishing TradeExecutedEvent to trade-output topic
     */
    @Bean
    public KafkaTemplate<String, TradeExecutedEvent> tradeKafkaTemplate() {
        return new KafkaTemplate<>(tradeEventProducerFactory());
    }

    /**
     * Producer factory for OrderBookUpdatedEvent
     */
    @Bean
    public ProducerFactory<String, OrderBookUpdatedEvent> orderBookEventProducerFactory() {
        return new DefaultKafkaProducerFactory<>(producerConfigs());
    }

    /**
     * KafkaTemplate for publishing OrderBookUpdatedEvent to orderbook-output topic
     */
    @Bean
    public KafkaTemplate<String, OrderBookUpdatedEvent> orderBookKafkaTemplate() {
        return new KafkaTemplate<>(orderBookEventProducerFactory());
    }
}
