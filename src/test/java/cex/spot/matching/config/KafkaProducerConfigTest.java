package cex.spot.matching.config;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KafkaProducerConfig
 */
class KafkaProducerConfigTest {

    private KafkaProducerConfig config;

    @BeforeEach
    void setUp() {
        config = new KafkaProducerConfig();
        ReflectionTestUtils.setField(config, "bootstrapServers", "localhost:9092");
        ReflectionTestUtils.setField(config, "maxBlockMs", 500L);
    }

    @Test
    void testSendBlockingIsBounded() {
        Map<String, Object> props = config.producerConfigs();

        assertEquals(500L, props.get(ProducerConfig.MAX_BLOCK_MS_CONFIG));
    }

    @Test
    void testMaxBlockIsConfigurable() {
        ReflectionTestUtils.setField(config, "maxBlockMs", 50L);

        assertEquals(50L, config.producerConfigs().get(ProducerConfig.MAX_BLOCK_MS_CONFIG));
    }

    @Test
    void testReliabilitySettings() {
        Map<String, Object> props = config.producerConfigs();

        assertEquals("localhost:9092", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("all", props.get(ProducerConfig.ACKS_CONFIG));
        assertEquals(true, props.get(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG));
    }
}
