package cex.spot.matching.service.event;

import cex.spot.matching.event.OrderBookUpdatedEvent;
import cex.spot.matching.event.TradeExecutedEvent;

/**
 * Receiver of matching events
 * Called with the symbol lock held: implementations must return quickly and must not call back into the engine.
 * Any blocking must have a fixed upper bound. The Kafka subscriber's send() blocks at most
 * matching.kafka.producer.max-block-ms (500 ms by default), the Redis cache write at most
 * spring.data.redis.timeout.
 */
public interface MatchEventSubscriber {

    /**
     * Name used in logs and metrics
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    default void onTradeExecuted(TradeExecutedEvent event) {
    }

    default void onOrderBookUpdated(OrderBookUpdatedEvent event) {
    }
}
