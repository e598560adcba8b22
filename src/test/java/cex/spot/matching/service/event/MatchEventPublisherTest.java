package cex.spot.matching.service.event;

import cex.spot.matching.domain.Trade;
import cex.spot.matching.dto.OrderBookSnapshot;
import cex.spot.matching.event.OrderBookUpdatedEvent;
import cex.spot.matching.event.TradeExecutedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Match Event Publisher Tests")
class MatchEventPublisherTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<TradeExecutedEvent> received = new ArrayList<>();
    private final List<OrderBookUpdatedEvent> receivedBooks = new ArrayList<>();
    private MatchEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new MatchEventPublisher();
        ReflectionTestUtils.setField(publisher, "meterRegistry", meterRegistry);
    }

    @Test
    @DisplayName("Trade event mirrors the trade")
    void testPublishTrade() {
        register(recorder());

        publisher.publishTrade(trade());

        assertThat(received).hasSize(1);
        TradeExecutedEvent event = received.get(0);
        assertThat(event.getTradeId()).isEqualTo(11L);
        assertThat(event.getSymbol()).isEqualTo("BTC/USDT");
        assertThat(event.getPrice()).isEqualByComparingTo("100.5");
        assertThat(event.getAmount()).isEqualByComparingTo("0.25");
        assertThat(event.getBuyOrderId()).isEqualTo(2L);
        assertThat(event.getSellOrderId()).isEqualTo(1L);
        assertThat(event.getTakerOrderId()).isEqualTo(2L);
        assertThat(event.getMakerOrderId()).isEqualTo(1L);
        assertThat(event.getMessageId()).isNotBlank();
    }

    @Test
    @DisplayName("A throwing subscriber is counted and the next one still receives the event")
    void testFailingSubscriberIsolated() {
        register(new MatchEventSubscriber() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public void onTradeExecuted(TradeExecutedEvent event) {
                throw new IllegalStateException("downstream unavailable");
            }
        }, recorder());

        publisher.publishTrade(trade());
        publisher.publishTrade(trade());

        assertThat(received).hasSize(2);
        assertThat(meterRegistry.get("matching.events.delivery.failed")
                .tag("subscriber", "broken")
                .tag("event", "trade_executed")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Order book event carries reason, order id and snapshot")
    void testPublishOrderBook() {
        register(recorder());
        OrderBookSnapshot snapshot = OrderBookSnapshot.builder().symbol("ETH/USDT").build();

        publisher.publishOrderBook(snapshot, OrderBookUpdatedEvent.Reason.ORDER_CANCELLED, 5L);

        assertThat(receivedBooks).hasSize(1);
        assertThat(receivedBooks.get(0).getSymbol()).isEqualTo("ETH/USDT");
        assertThat(receivedBooks.get(0).getReason()).isEqualTo(OrderBookUpdatedEvent.Reason.ORDER_CANCELLED);
        assertThat(receivedBooks.get(0).getOrderId()).isEqualTo(5L);
        assertThat(receivedBooks.get(0).getSnapshot()).isSameAs(snapshot);
    }

    @Test
    @DisplayName("Publishing without subscribers is a no-op")
    void testNoSubscribers() {
        publisher.publishTrade(trade());

        assertThat(publisher.getSubscribers()).isEmpty();
        assertThat(meterRegistry.find("matching.events.delivery.failed").counter()).isNull();
    }

    private void register(MatchEventSubscriber... subscribers) {
        ReflectionTestUtils.setField(publisher, "subscribers", List.of(subscribers));
    }

    private MatchEventSubscriber recorder() {
        return new MatchEventSubscriber() {
            @Override
            public void onTradeExecuted(TradeExecutedEvent event) {
                received.add(event);
            }

            @Override
            public void onOrderBookUpdated(OrderBookUpdatedEvent event) {
                receivedBooks.add(event);
            }
        };
    }

    private Trade trade() {
        return Trade.builder()
                .tradeId(11L)
                .symbol("BTC/USDT")
                .price(new BigDecimal("100.5"))
                .amount(new BigDecimal("0.25"))
                .buyerUserId(20L)
                .sellerUserId(10L)
                .buyOrderId(2L)
                .sellOrderId(1L)
                .takerOrderId(2L)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
