package cex.spot.matching.service;

import cex.spot.matching.BaseIntegrationTest;
import cex.spot.matching.domain.Order;
import cex.spot.matching.dto.MatchResult;
import cex.spot.matching.dto.OrderBookSnapshot;
import cex.spot.matching.enums.OrderSide;
import cex.spot.matching.enums.OrderStatus;
import cex.spot.matching.exception.PersistenceFailureException;
import cex.spot.matching.testutil.OrderTestBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;

/**
 * Integration tests for the per-fill transaction of MatchPersistenceService
 * A write failing late in a fill must undo the whole fill in the database
 * while the fills committed before it stay
 */
@DisplayName("Match Persistence Integration Tests")
class MatchPersistenceServiceIntegrationTest extends BaseIntegrationTest {

    @SpyBean
    private OrderService spiedOrderService;

    @Test
    @DisplayName("Maker update failing in the second fill rolls back that fill's trade and taker update")
    void testSecondMakerUpdateFailureRollsBackFill() {
        // GIVEN: two asks of 1
        Order firstAsk = place(1L, OrderSide.SELL, "100", "1");
        Order secondAsk = place(2L, OrderSide.SELL, "101", "1");
        Long secondAskId = secondAsk.getOrderId();

        // The trade row and the taker update of the second fill are written before this throws
        doThrow(new PersistenceFailureException("orders store unavailable"))
                .when(spiedOrderService)
                .updateOrder(argThat(order -> order != null && secondAskId.equals(order.getOrderId())));

        // WHEN: a buy sweeps both levels
        MatchResult result = matchingEngineService.placeOrder(
                OrderTestBuilder.limit().userId(3L).buy().price("101").amount("2").build());

        // THEN: only the first fill is in the database
        assertThat(result.isPersistenceFailure()).isTrue();
        assertThat(result.getTrades()).hasSize(1);
        Long takerId = result.getUpdatedOrder().getOrderId();

        assertDatabaseCounts(3, 1);
        assertThat(tradeMapper.findByOrderId(secondAskId)).isEmpty();
        assertTrade(tradeMapper.findByOrderId(firstAsk.getOrderId()).get(0), takerId, firstAsk.getOrderId(), "100", "1");

        assertOrderState(orderMapper.findById(firstAsk.getOrderId()), "FILLED", "1", "0");
        assertOrderState(orderMapper.findById(takerId), "PARTIALLY_FILLED", "1", "1");
        assertOrderState(orderMapper.findById(secondAskId), "PENDING", "0", "1");

        assertThat(orderBookMapper.findBySymbol(SYMBOL).getVolume24h()).isEqualByComparingTo("1");
        assertThat(orderBookMapper.findBySymbol(SYMBOL).getLastPrice()).isEqualByComparingTo("100");

        // Memory agrees with the committed rows
        OrderBookSnapshot snapshot = matchingEngineService.getOrderBook(SYMBOL);
        assertThat(snapshot.getAsks()).extracting(OrderBookSnapshot.RestingOrderView::getOrderId).containsExactly(secondAskId);
        assertThat(snapshot.getBids()).extracting(OrderBookSnapshot.RestingOrderView::getOrderId).containsExactly(takerId);
        assertThat(snapshot.getVolume24h()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("Aggregate update failing in the second fill rolls back all of that fill's writes")
    void testSecondStatsUpdateFailureRollsBackFill() {
        // GIVEN: two asks of 1
        Order firstAsk = place(1L, OrderSide.SELL, "100", "1");
        Order secondAsk = place(2L, OrderSide.SELL, "101", "1");
        Long secondAskId = secondAsk.getOrderId();

        // After the maker row of the second fill is written, remove the book row so updateStats hits nothing
        AtomicBoolean insideTransaction = new AtomicBoolean();
        doAnswer(invocation -> {
            Object updated = invocation.callRealMethod();
            insideTransaction.set(TransactionSynchronizationManager.isActualTransactionActive());
            jdbcTemplate.update("DELETE FROM order_books WHERE symbol = ?", SYMBOL);
            return updated;
        }).when(spiedOrderService)
                .updateOrder(argThat(order -> order != null && secondAskId.equals(order.getOrderId())));

        // WHEN
        MatchResult result = matchingEngineService.placeOrder(
                OrderTestBuilder.limit().userId(3L).buy().price("101").amount("2").build());

        // THEN: the whole second fill is gone, the delete included
        assertThat(insideTransaction).isTrue();
        assertThat(result.isPersistenceFailure()).isTrue();
        assertThat(result.getTrades()).hasSize(1);
        Long takerId = result.getUpdatedOrder().getOrderId();

        assertDatabaseCounts(3, 1);
        assertThat(tradeMapper.findByOrderId(secondAskId)).isEmpty();
        assertOrderState(orderMapper.findById(firstAsk.getOrderId()), "FILLED", "1", "0");
        assertOrderState(orderMapper.findById(takerId), "PARTIALLY_FILLED", "1", "1");
        assertOrderState(orderMapper.findById(secondAskId), "PENDING", "0", "1");

        assertThat(orderBookMapper.findBySymbol(SYMBOL)).isNotNull();
        assertThat(orderBookMapper.findBySymbol(SYMBOL).getVolume24h()).isEqualByComparingTo("1");
        assertThat(orderBookMapper.findBySymbol(SYMBOL).getHigh24h()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Without failures both fills commit")
    void testSweepCommitsEveryFill() {
        place(1L, OrderSide.SELL, "100", "1");
        place(2L, OrderSide.SELL, "101", "1");

        MatchResult result = matchingEngineService.placeOrder(
                OrderTestBuilder.limit().userId(3L).buy().price("101").amount("2").build());

        assertThat(result.isPersistenceFailure()).isFalse();
        assertThat(result.getUpdatedOrder().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertDatabaseCounts(3, 2);
        assertThat(orderBookMapper.findBySymbol(SYMBOL).getVolume24h()).isEqualByComparingTo(new BigDecimal("2"));
    }
}
