package cex.spot.matching.enums;

/**
 * Order side enum - BUY or SELL
 */
public enum OrderSide {
    BUY,
    SELL;

    /**
     * The side an incoming order matches against
     */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
