package cex.spot.matching.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Trade-derived aggregates of one order book.
 * Immutable: each trade produces the next value, which is persisted before it is applied to the book.
 */
@Value
@Builder(toBuilder = true)
public class OrderBookStats {

    /**
     * Last traded price, null until the first trade
     */
    BigDecimal lastPrice;

    /**
     * Rolling 24h traded amount
     */
    @Builder.Default
    BigDecimal volume24h = BigDecimal.ZERO;

    /**
     * Rolling 24h highest traded price
     */
    BigDecimal high24h;

    /**
     * Rolling 24h lowest traded price
     */
    BigDecimal low24h;

    LocalDateTime updatedAt;

    public static OrderBookStats empty() {
        return OrderBookStats.builder().build();
    }

    /**
     * Aggregates after one more trade. High and low only ever widen; the first trade initialises both.
     *
     * @param price execution price
     * @param amount executed amount
     * @return the next aggregates
     */
    public OrderBookStats afterTrade(BigDecimal price, BigDecimal amount) {
        BigDecimal high = (high24h == null || price.compareTo(high24h) > 0) ? price : high24h;
        BigDecimal low = (low24h == null || price.compareTo(low24h) < 0) ? price : low24h;

        return toBuilder()
                .lastPrice(price)
                .volume24h(volume24h.add(amount))
                .high24h(high)
                .low24h(low)
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
