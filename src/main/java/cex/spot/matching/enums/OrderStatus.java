package cex.spot.matching.enums;

import java.math.BigDecimal;

/**
 * Order status enum representing the lifecycle of an order
 * PENDING -> PARTIALLY_FILLED -> FILLED, or PENDING/PARTIALLY_FILLED -> CANCELLED
 */
public enum OrderStatus {
    /**
     * Order accepted, nothing filled yet
     */
    PENDING,

    /**
     * Order has been partially filled and still rests in the book
     */
    PARTIALLY_FILLED,

    /**
     * Order has been completely filled
     */
    FILLED,

    /**
     * Order has been cancelled by its owner
     */
    CANCELLED;

    /**
     * Terminal states never transition again
     */
    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED;
    }

    /**
     * Derive the fill state of a non-cancelled order
     *
     * @param filledAmount amount filled so far
     * @param amount original order amount
     * @return PENDING, PARTIALLY_FILLED or FILLED
     */
    public static OrderStatus fromFill(BigDecimal filledAmount, BigDecimal amount) {
        if (filledAmount.compareTo(amount) >= 0) {
            return FILLED;
        }
        if (filledAmount.signum() > 0) {
            return PARTIALLY_FILLED;
        }
        return PENDING;
    }
}
