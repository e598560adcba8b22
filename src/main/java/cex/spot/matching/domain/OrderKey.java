package cex.spot.matching.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Sort key of a resting order: price first, then creation time, then order id
 */
@Value
public class OrderKey {

    BigDecimal price;

    LocalDateTime createdAt;

    Long orderId;

    /**
     * Time priority within one price level, order id breaks equal timestamps
     */
    private static final Comparator<OrderKey> TIME_PRIORITY =
            Comparator.comparing(OrderKey::getCreatedAt)
                    .thenComparing(OrderKey::getOrderId);

    /**
     * Bids: highest price first
     */
    public static final Comparator<OrderKey> BID_PRIORITY =
            Comparator.comparing(OrderKey::getPrice, Comparator.reverseOrder())
                    .thenComparing(TIME_PRIORITY);

    /**
     * Asks: lowest price first
     */
    public static final Comparator<OrderKey> ASK_PRIORITY =
            Comparator.comparing(OrderKey::getPrice)
                    .thenComparing(TIME_PRIORITY);

    public static OrderKey of(Order order) {
        return new OrderKey(order.getPrice(), order.getCreatedAt(), order.getOrderId());
    }
}
