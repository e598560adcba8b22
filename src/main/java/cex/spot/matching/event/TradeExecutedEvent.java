package cex.spot.matching.event;

import cex.spot.matching.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Event published when a trade is executed
 * Carries both order ids and both user ids so a consumer can relate the trade to its two orders
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeExecutedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Unique message ID for idempotency (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private Long tradeId;

    /**
     * Trading symbol (e.g., BTC/USDT)
     */
    private String symbol;

    /**
     * Execution price (maker price)
     */
    private BigDecimal price;

    private BigDecimal amount;

    private Long buyerUserId;

    private Long sellerUserId;

    private Long buyOrderId;

    private Long sellOrderId;

    /**
     * Taker order ID (order that triggered the match)
     */
    private Long takerOrderId;

    /**
     * Maker order ID (order from the book)
     */
    private Long makerOrderId;

    private LocalDateTime executedAt;

    /**
     * Create event from Trade entity
     *
     * @param trade the persisted trade
     * @return TradeExecutedEvent
     */
    public static TradeExecutedEvent fromTrade(Trade trade) {
        return TradeExecutedEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .tradeId(trade.getTradeId())
                .symbol(trade.getSymbol())
                .price(trade.getPrice())
                .amount(trade.getAmount())
                .buyerUserId(trade.getBuyerUserId())
                .sellerUserId(trade.getSellerUserId())
                .buyOrderId(trade.getBuyOrderId())
                .sellOrderId(trade.getSellOrderId())
                .takerOrderId(trade.getTakerOrderId())
                .makerOrderId(trade.getMakerOrderId())
                .executedAt(trade.getCreatedAt())
                .build();
    }
}
