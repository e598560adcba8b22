package cex.spot.matching.service.kafka;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IdempotencyService
 */
class IdempotencyServiceTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private IdempotencyService idempotencyService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        idempotencyService = new IdempotencyService();
        ReflectionTestUtils.setField(idempotencyService, "redisTemplate", redisTemplate);
    }

    @Test
    void testUnknownCommandIsNotProcessed() {
        when(redisTemplate.hasKey("idempotency:processed:m-1")).thenReturn(false);

        assertFalse(idempotencyService.isMessageProcessed("m-1"));
    }

    @Test
    void testRecordedCommandIsProcessed() {
        when(redisTemplate.hasKey("idempotency:processed:m-1")).thenReturn(true);

        assertTrue(idempotencyService.isMessageProcessed("m-1"));
    }

    @Test
    void testNullFromRedisCountsAsNotProcessed() {
        when(redisTemplate.hasKey("idempotency:processed:m-1")).thenReturn(null);

        assertFalse(idempotencyService.isMessageProcessed("m-1"));
    }

    @Test
    void testMarkStoresOrderIdForADay() {
        idempotencyService.markMessageProcessed("m-1", 42L);

        verify(valueOperations).set("idempotency:processed:m-1", "42", Duration.ofHours(24));
    }

    @Test
    void testConfiguredTtlIsUsed() {
        ReflectionTestUtils.setField(idempotencyService, "ttlHours", 72L);

        idempotencyService.markMessageProcessed("m-1", 42L);

        verify(valueOperations).set("idempotency:processed:m-1", "42", Duration.ofHours(72));
    }

    @Test
    void testFindOrderId() {
        when(valueOperations.get("idempotency:processed:m-1")).thenReturn("42");

        assertEquals("42", idempotencyService.findOrderId("m-1"));
        assertNull(idempotencyService.findOrderId("m-2"));
    }
}
