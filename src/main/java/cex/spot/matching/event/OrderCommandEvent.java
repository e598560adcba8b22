package cex.spot.matching.event;

import cex.spot.matching.domain.Order;
import cex.spot.matching.enums.OrderSide;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Command consumed from the order-input topic
 * PLACE carries a new order; CANCEL carries orderId and the requesting userId
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCommandEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public enum CommandType {
        PLACE,
        CANCEL
    }

    /**
     * Unique message ID for tracing (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private CommandType type;

    /**
     * Target order (CANCEL only)
     */
    private Long orderId;

    private Long userId;

    private String symbol;

    private OrderSide side;

    private BigDecimal price;

    private BigDecimal amount;

    /**
     * Convert a PLACE command to a new Order entity
     * Note: status, id and timestamps are assigned by the matching engine
     *
     * @return Order entity
     */
    public Order toOrder() {
        return Order.builder()
                .userId(this.userId)
                .symbol(this.symbol)
                .side(this.side)
                .price(this.price)
                .amount(this.amount)
                .build();
    }
}
