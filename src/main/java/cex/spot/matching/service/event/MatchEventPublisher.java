package cex.spot.matching.service.event;

import cex.spot.matching.domain.Trade;
import cex.spot.matching.dto.OrderBookSnapshot;
import cex.spot.matching.event.OrderBookUpdatedEvent;
import cex.spot.matching.event.TradeExecutedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fire-and-forget fan-out of matching events
 * Every subscriber is called in isolation: a failure is logged and counted, never rethrown
 */
@Slf4j
@Component
public class MatchEventPublisher {

    @Autowired(required = false)
    private List<MatchEventSubscriber> subscribers = new ArrayList<>();

    @Autowired
    private MeterRegistry meterRegistry;

    /**
     * Publish trade_executed
     *
     * @param trade the persisted trade
     */
    public void publishTrade(Trade trade) {
        TradeExecutedEvent event = TradeExecutedEvent.fromTrade(trade);
        deliver("trade_executed", event.getSymbol(), subscriber -> subscriber.onTradeExecuted(event));
    }

    /**
     * Publish order_book_updated
     *
     * @param snapshot the book after the change
     * @param reason what changed the book
     * @param orderId the order that was placed or cancelled
     */
    public void publishOrderBook(OrderBookSnapshot snapshot, OrderBookUpdatedEvent.Reason reason, Long orderId) {
        OrderBookUpdatedEvent event = OrderBookUpdatedEvent.of(snapshot, reason, orderId);
        deliver("order_book_updated", event.getSymbol(), subscriber -> subscriber.onOrderBookUpdated(event));
    }

    public List<MatchEventSubscriber> getSubscribers() {
        return subscribers;
    }

    private void deliver(String eventType, String symbol, Consumer<MatchEventSubscriber> delivery) {
        for (MatchEventSubscriber subscriber : subscribers) {
            try {
                delivery.accept(subscriber);
            } catch (RuntimeException e) {
                log.warn("Event delivery failed: subscriber={}, event={}, symbol={}, error={}",
                        subscriber.getName(), eventType, symbol, e.getMessage(), e);
                Counter.builder("matching.events.delivery.failed")
                        .description("Matching events a subscriber failed to handle")
                        .tag("subscriber", subscriber.getName())
                        .tag("event", eventType)
                        .register(meterRegistry)
                        .increment();
            }
        }
    }
}
