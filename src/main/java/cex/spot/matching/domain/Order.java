package cex.spot.matching.domain;

import cex.spot.matching.enums.OrderSide;
import cex.spot.matching.enums.OrderStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Order entity representing a limit order for one symbol
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    /**
     * Unique order identifier, assigned when the order is persisted
     */
    private Long orderId;

    /**
     * User who placed the order
     */
    private Long userId;

    /**
     * Trading symbol (e.g., "BTC/USDT")
     */
    private String symbol;

    /**
     * Order side - BUY or SELL
     */
    private OrderSide side;

    /**
     * Limit price per unit
     */
    private BigDecimal price;

    /**
     * Original amount to buy or sell
     */
    private BigDecimal amount;

    /**
     * Amount that has been filled so far
     */
    @Builder.Default
    private BigDecimal filledAmount = BigDecimal.ZERO;

    /**
     * Current status of the order
     */
    private OrderStatus status;

    /**
     * Timestamp when order was created, used for time priority
     */
    private LocalDateTime createdAt;

    /**
     * Timestamp when order was last updated
     */
    private LocalDateTime updatedAt;

    /**
     * Get remaining amount to be filled
     */
    @JsonIgnore
    public BigDecimal getRemainingAmount() {
        return amount.subtract(filledAmount);
    }

    /**
     * Check if order is completely filled
     */
    @JsonIgnore
    public boolean isFilled() {
        return filledAmount.compareTo(amount) >= 0;
    }

    /**
     * Check if order can still rest in the book
     */
    @JsonIgnore
    public boolean isResting() {
        return status == OrderStatus.PENDING || status == OrderStatus.PARTIALLY_FILLED;
    }

    /**
     * Add a fill and recompute the fill-derived status
     *
     * @param fillAmount amount executed by one trade
     */
    public void applyFill(BigDecimal fillAmount) {
        this.filledAmount = filledAmount.add(fillAmount);
        this.status = OrderStatus.fromFill(filledAmount, amount);
        this.updatedAt = LocalDateTime.now();
    }
}
