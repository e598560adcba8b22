package cex.spot.matching.service.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis record of order commands the engine has already applied
 *
 * Kafka delivers at least once: a consumer that dies after placeOrder but before
 * the offset commit gets the same command again after the rebalance. Placing it
 * twice would create a second order, so the consumer looks up the command's
 * messageId here first. Keys: idempotency:processed:{messageId} -> orderId
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "matching.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class IdempotencyService {

    static final String PROCESSED_KEY_PREFIX = "idempotency:processed:";

    @Autowired
    private StringRedisTemplate redisTemplate;

    /**
     * Must outlive the order-input topic's redelivery window
     */
    @Value("${matching.kafka.idempotency.ttl-hours:24}")
    private long ttlHours = 24;

    /**
     * Whether a command with this messageId already reached the engine
     *
     * @param messageId messageId of the order command
     * @return true for a redelivery
     */
    public boolean isMessageProcessed(String messageId) {
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(PROCESSED_KEY_PREFIX + messageId))) {
            return false;
        }
        log.warn("Order command already applied: messageId={}", messageId);
        return true;
    }

    /**
     * Record a command once the engine returned for it
     *
     * @param messageId messageId of the order command
     * @param orderId order placed or cancelled by the command
     */
    public void markMessageProcessed(String messageId, Long orderId) {
        redisTemplate.opsForValue().set(PROCESSED_KEY_PREFIX + messageId,
                String.valueOf(orderId), Duration.ofHours(ttlHours));
        log.debug("Order command recorded: messageId={}, orderId={}, ttlHours={}", messageId, orderId, ttlHours);
    }

    /**
     * Order the command resolved to the first time, or null if unknown or expired
     */
    public String findOrderId(String messageId) {
        return redisTemplate.opsForValue().get(PROCESSED_KEY_PREFIX + messageId);
    }
}
