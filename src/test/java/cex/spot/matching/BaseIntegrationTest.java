package cex.spot.matching;

import cex.spot.matching.domain.Order;
import cex.spot.matching.domain.Trade;
import cex.spot.matching.dto.OrderBookSnapshot;
import cex.spot.matching.enums.OrderSide;
import cex.spot.matching.mapper.OrderBookMapper;
import cex.spot.matching.mapper.OrderMapper;
import cex.spot.matching.mapper.TradeMapper;
import cex.spot.matching.service.MatchingEngineService;
import cex.spot.matching.service.OrderBookService;
import cex.spot.matching.service.OrderService;
import cex.spot.matching.testutil.OrderTestBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for integration tests
 * Runs against H2 in MySQL mode; every test method gets a fresh context,
 * so both the database and the in-memory books start empty
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
public abstract class BaseIntegrationTest {

    protected static final String SYMBOL = "BTC/USDT";

    @Autowired
    protected MatchingEngineService matchingEngineService;

    @Autowired
    protected OrderMapper orderMapper;

    @Autowired
    protected TradeMapper tradeMapper;

    @Autowired
    protected OrderBookMapper orderBookMapper;

    @Autowired
    protected OrderService orderService;

    @Autowired
    protected OrderBookService orderBookService;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    // ============= ASSERTION UTILITIES =============

    /**
     * Assert order state matches expected values
     */
    protected void assertOrderState(Order order,
                                    String expectedStatus,
                                    String expectedFilledAmount,
                                    String expectedRemainingAmount) {
        assertThat(order.getStatus().name()).isEqualTo(expectedStatus);
        assertThat(order.getFilledAmount()).isEqualByComparingTo(expectedFilledAmount);
        assertThat(order.getRemainingAmount()).isEqualByComparingTo(expectedRemainingAmount);
    }

    /**
     * Assert trade matches expected values
     */
    protected void assertTrade(Trade trade,
                               Long expectedBuyOrderId,
                               Long expectedSellOrderId,
                               String expectedPrice,
                               String expectedAmount) {
        assertThat(trade.getBuyOrderId()).isEqualTo(expectedBuyOrderId);
        assertThat(trade.getSellOrderId()).isEqualTo(expectedSellOrderId);
        assertThat(trade.getPrice()).isEqualByComparingTo(expectedPrice);
        assertThat(trade.getAmount()).isEqualByComparingTo(expectedAmount);
    }

    /**
     * Assert order book best prices
     */
    protected void assertOrderBookPrices(OrderBookSnapshot snapshot,
                                         String expectedBestBid,
                                         String expectedBestAsk) {
        if (expectedBestBid != null) {
            assertThat(snapshot.getBestBid()).isEqualByComparingTo(expectedBestBid);
        } else {
            assertThat(snapshot.getBestBid()).isNull();
        }

        if (expectedBestAsk != null) {
            assertThat(snapshot.getBestAsk()).isEqualByComparingTo(expectedBestAsk);
        } else {
            assertThat(snapshot.getBestAsk()).isNull();
        }
    }

    /**
     * Assert database contains expected number of records
     */
    protected void assertDatabaseCounts(int expectedOrders, int expectedTrades) {
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM orders", Integer.class))
                .isEqualTo(expectedOrders);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM trades", Integer.class))
                .isEqualTo(expectedTrades);
    }

    // ============= TEST DATA BUILDERS =============

    /**
     * Place an order through the engine and return it as stored
     */
    protected Order place(Long userId, OrderSide side, String price, String amount) {
        OrderTestBuilder builder = OrderTestBuilder.limit()
                .userId(userId)
                .symbol(SYMBOL)
                .price(price)
                .amount(amount);
        if (side == OrderSide.BUY) {
            builder.buy();
        } else {
            builder.sell();
        }
        return matchingEngineService.placeOrder(builder.build()).getUpdatedOrder();
    }
}
