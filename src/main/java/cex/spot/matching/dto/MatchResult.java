package cex.spot.matching.dto;

import cex.spot.matching.domain.Order;
import cex.spot.matching.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of placing an order
 * Contains the incoming order, the trades it produced and the resting orders it filled
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {
    /**
     * The incoming order with updated filledAmount and status
     */
    private Order updatedOrder;

    /**
     * Trades committed during matching, in execution order
     */
    @Builder.Default
    private List<Trade> trades = new ArrayList<>();

    /**
     * Resting orders that were partially or fully filled
     */
    @Builder.Default
    private List<Order> modifiedOrders = new ArrayList<>();

    /**
     * Whether the incoming order was fully matched
     */
    private boolean fullyMatched;

    /**
     * Whether matching stopped early because a fill could not be persisted.
     * Trades listed above are committed either way.
     */
    private boolean persistenceFailure;

    /**
     * Cause of the persistence failure, if any
     */
    private String failureMessage;

    /**
     * Sum of executed amounts
     */
    public BigDecimal getExecutedAmount() {
        return trades.stream()
                .map(Trade::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
