package cex.spot.matching.event;

import cex.spot.matching.dto.OrderBookSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.UUID;

/**
 * Event published after every place or cancel with the resulting order book snapshot
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBookUpdatedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * What changed the book
     */
    public enum Reason {
        ORDER_PLACED,
        ORDER_CANCELLED
    }

    /**
     * Unique message ID for idempotency (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private String symbol;

    private Reason reason;

    /**
     * Order that was placed or cancelled
     */
    private Long orderId;

    private OrderBookSnapshot snapshot;

    public static OrderBookUpdatedEvent of(OrderBookSnapshot snapshot, Reason reason, Long orderId) {
        return OrderBookUpdatedEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .symbol(snapshot.getSymbol())
                .reason(reason)
                .orderId(orderId)
                .snapshot(snapshot)
                .build();
    }
}
