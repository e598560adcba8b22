package cex.spot.matching.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time view of an order book: trade aggregates plus both sides of resting orders.
 * Bids are sorted by price descending, asks by price ascending, both then by creation time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBookSnapshot {

    private String symbol;

    /**
     * Last traded price (null before the first trade)
     */
    private BigDecimal lastPrice;

    private BigDecimal volume24h;

    private BigDecimal high24h;

    private BigDecimal low24h;

    @Builder.Default
    private List<RestingOrderView> bids = new ArrayList<>();

    @Builder.Default
    private List<RestingOrderView> asks = new ArrayList<>();

    private BigDecimal bestBid;

    private BigDecimal bestAsk;

    private BigDecimal spread;

    /**
     * When the snapshot was taken
     */
    private LocalDateTime timestamp;

    /**
     * One resting order as seen by readers
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RestingOrderView {

        private Long orderId;

        private BigDecimal price;

        /**
         * Unfilled amount still available to match
         */
        private BigDecimal amount;

        private LocalDateTime createdAt;
    }
}
