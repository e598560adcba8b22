package cex.spot.matching.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Trade entity representing one fill between a resting (maker) order and an incoming (taker) order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {
    /**
     * Unique trade identifier
     */
    private Long tradeId;

    /**
     * Trading symbol (e.g., "BTC/USDT")
     */
    private String symbol;

    /**
     * Execution price, always the maker's limit price
     */
    private BigDecimal price;

    /**
     * Amount executed
     */
    private BigDecimal amount;

    /**
     * User on the buy side
     */
    private Long buyerUserId;

    /**
     * User on the sell side
     */
    private Long sellerUserId;

    /**
     * Buy order that was matched
     */
    private Long buyOrderId;

    /**
     * Sell order that was matched
     */
    private Long sellOrderId;

    /**
     * Incoming order that triggered the match
     */
    private Long takerOrderId;

    /**
     * Timestamp when trade was executed
     */
    private LocalDateTime createdAt;

    /**
     * Resting order that set the price
     */
    public Long getMakerOrderId() {
        return takerOrderId != null && takerOrderId.equals(buyOrderId) ? sellOrderId : buyOrderId;
    }

    /**
     * Calculate total trade value
     */
    public BigDecimal getTotalValue() {
        return price.multiply(amount);
    }
}
