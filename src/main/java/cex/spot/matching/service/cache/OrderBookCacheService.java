package cex.spot.matching.service.cache;

import cex.spot.matching.dto.OrderBookSnapshot;
import cex.spot.matching.event.OrderBookUpdatedEvent;
import cex.spot.matching.service.event.MatchEventSubscriber;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Order book snapshot cache with two levels
 * L1: Caffeine (local, short TTL)
 * L2: Redis (shared between instances, short TTL)
 *
 * The cache is only a read accelerator: a Redis failure degrades to a miss and
 * matching never reads from it.
 */
@Slf4j
@Service
public class OrderBookCacheService implements MatchEventSubscriber {

    private static final String KEY_PREFIX = "order_book:";

    @Autowired(required = false)
    private StringRedisTemplate redisTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${matching.cache.local.enabled:true}")
    private boolean localEnabled;

    @Value("${matching.cache.local.ttl-ms:1000}")
    private long localTtlMs;

    @Value("${matching.cache.local.max-size:1000}")
    private long localMaxSize;

    @Value("${matching.cache.redis.enabled:true}")
    private boolean redisEnabled;

    @Value("${matching.cache.redis.ttl-ms:1000}")
    private long redisTtlMs;

    // L1 Cache: Caffeine
    private Cache<String, OrderBookSnapshot> localCache;

    /**
     * Initialize local cache after dependencies are injected
     */
    @PostConstruct
    public void initializeCache() {
        localCache = Caffeine.newBuilder()
                .maximumSize(localMaxSize)
                .expireAfterWrite(Duration.ofMillis(localTtlMs))
                .recordStats()
                .build();
        log.info("Order book cache initialized: local={} ({}ms), redis={} ({}ms)",
                localEnabled, localTtlMs, isRedisActive(), redisTtlMs);
    }

    /**
     * Read a cached snapshot (L1 → L2)
     *
     * @param symbol the trading symbol
     * @return the snapshot, or null on a miss
     */
    public OrderBookSnapshot get(String symbol) {
        String cacheKey = buildCacheKey(symbol);

        if (localEnabled) {
            OrderBookSnapshot snapshot = localCache.getIfPresent(cacheKey);
            if (snapshot != null) {
                log.debug("L1 cache hit: {}", cacheKey);
                return snapshot;
            }
        }

        if (!isRedisActive()) {
            return null;
        }

        try {
            String json = redisTemplate.opsForValue().get(cacheKey);
            if (json == null) {
                return null;
            }
            OrderBookSnapshot snapshot = objectMapper.readValue(json, OrderBookSnapshot.class);
            log.debug("L2 cache hit: {}", cacheKey);
            if (localEnabled) {
                localCache.put(cacheKey, snapshot);
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached order book: key={}, error={}", cacheKey, e.getMessage());
            evictRedis(cacheKey);
            return null;
        } catch (RuntimeException e) {
            log.warn("Redis read failed, treating as cache miss: key={}, error={}", cacheKey, e.getMessage());
            return null;
        }
    }

    /**
     * Store a snapshot in both levels with their short expiry
     *
     * @param snapshot the snapshot to cache
     */
    public void put(OrderBookSnapshot snapshot) {
        String cacheKey = buildCacheKey(snapshot.getSymbol());

        if (localEnabled) {
            localCache.put(cacheKey, snapshot);
        }

        if (!isRedisActive()) {
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(cacheKey, json, Duration.ofMillis(redisTtlMs));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize order book snapshot: symbol={}, error={}",
                    snapshot.getSymbol(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Redis write failed, cache not refreshed: key={}, error={}", cacheKey, e.getMessage());
        }
    }

    /**
     * Drop a symbol from both levels
     *
     * @param symbol the trading symbol
     */
    public void evict(String symbol) {
        String cacheKey = buildCacheKey(symbol);
        localCache.invalidate(cacheKey);
        if (isRedisActive()) {
            evictRedis(cacheKey);
        }
    }

    /**
     * Refresh the cache with the snapshot taken right after the change
     */
    @Override
    public void onOrderBookUpdated(OrderBookUpdatedEvent event) {
        put(event.getSnapshot());
    }

    public String buildCacheKey(String symbol) {
        return KEY_PREFIX + symbol;
    }

    private boolean isRedisActive() {
        return redisEnabled && redisTemplate != null;
    }

    private void evictRedis(String cacheKey) {
        try {
            redisTemplate.delete(cacheKey);
        } catch (RuntimeException e) {
            log.warn("Redis delete failed: key={}, error={}", cacheKey, e.getMessage());
        }
    }
}
