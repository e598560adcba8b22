package cex.spot.matching.domain;

import cex.spot.matching.dto.OrderBookSnapshot;
import cex.spot.matching.enums.OrderSide;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * OrderBook entity for one trading symbol
 * Persistent part: trade aggregates (last price, 24h volume/high/low)
 * Transient part: resting bids and asks in ConcurrentSkipListMaps sorted by price-time priority,
 * so readers can iterate them without holding the symbol lock
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderBook {
    /**
     * Unique order book identifier
     */
    private Long id;

    /**
     * Trading symbol (e.g., "BTC/USDT")
     */
    private String symbol;

    /**
     * Last traded price, null until the first trade
     */
    private BigDecimal lastPrice;

    /**
     * Rolling 24h traded amount
     */
    private BigDecimal volume24h = BigDecimal.ZERO;

    /**
     * Rolling 24h high
     */
    private BigDecimal high24h;

    /**
     * Rolling 24h low
     */
    private BigDecimal low24h;

    /**
     * Timestamp when order book was last updated
     */
    private LocalDateTime updatedAt;

    /**
     * Buy orders: highest price first, then earliest creation
     */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final ConcurrentSkipListMap<OrderKey, Order> buyOrders =
            new ConcurrentSkipListMap<>(OrderKey.BID_PRIORITY);

    /**
     * Sell orders: lowest price first, then earliest creation
     */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final ConcurrentSkipListMap<OrderKey, Order> sellOrders =
            new ConcurrentSkipListMap<>(OrderKey.ASK_PRIORITY);

    /**
     * Resting orders by id, for cancellation lookups
     */
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final Map<Long, Order> ordersById = new ConcurrentHashMap<>();

    public static OrderBook empty(String symbol) {
        OrderBook orderBook = new OrderBook();
        orderBook.setSymbol(symbol);
        orderBook.setUpdatedAt(LocalDateTime.now());
        return orderBook;
    }

    /**
     * Current aggregates as an immutable value
     */
    public OrderBookStats getStats() {
        return OrderBookStats.builder()
                .lastPrice(lastPrice)
                .volume24h(volume24h == null ? BigDecimal.ZERO : volume24h)
                .high24h(high24h)
                .low24h(low24h)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Replace the aggregates with an already persisted value
     */
    public void applyStats(OrderBookStats stats) {
        this.lastPrice = stats.getLastPrice();
        this.volume24h = stats.getVolume24h();
        this.high24h = stats.getHigh24h();
        this.low24h = stats.getLow24h();
        this.updatedAt = stats.getUpdatedAt();
    }

    /**
     * Fold one trade into the aggregates
     *
     * @param price execution price
     * @param amount executed amount
     */
    public void updateOnTrade(BigDecimal price, BigDecimal amount) {
        applyStats(getStats().afterTrade(price, amount));
    }

    /**
     * Resting orders of one side in matching priority
     */
    public Collection<Order> getRestingOrders(OrderSide side) {
        return sideOf(side).values();
    }

    public Order getRestingOrder(Long orderId) {
        return ordersById.get(orderId);
    }

    public void addRestingOrder(Order order) {
        sideOf(order.getSide()).put(OrderKey.of(order), order);
        ordersById.put(order.getOrderId(), order);
        updatedAt = LocalDateTime.now();
    }

    /**
     * @return true if the order was resting
     */
    public boolean removeRestingOrder(Order order) {
        Order removed = ordersById.remove(order.getOrderId());
        if (removed == null) {
            return false;
        }
        sideOf(removed.getSide()).remove(OrderKey.of(removed));
        updatedAt = LocalDateTime.now();
        return true;
    }

    /**
     * Get best bid price (highest buy price)
     */
    public BigDecimal getBestBid() {
        Map.Entry<OrderKey, Order> best = buyOrders.firstEntry();
        return best == null ? null : best.getKey().getPrice();
    }

    /**
     * Get best ask price (lowest sell price)
     */
    public BigDecimal getBestAsk() {
        Map.Entry<OrderKey, Order> best = sellOrders.firstEntry();
        return best == null ? null : best.getKey().getPrice();
    }

    /**
     * Get bid-ask spread
     */
    public BigDecimal getSpread() {
        BigDecimal bid = getBestBid();
        BigDecimal ask = getBestAsk();
        if (bid == null || ask == null) {
            return null;
        }
        return ask.subtract(bid);
    }

    /**
     * Build a read-only view of the book. Safe to call without the symbol lock;
     * a concurrent match may make the result stale.
     */
    public OrderBookSnapshot snapshot() {
        return OrderBookSnapshot.builder()
                .symbol(symbol)
                .lastPrice(lastPrice)
                .volume24h(volume24h)
                .high24h(high24h)
                .low24h(low24h)
                .bids(viewOf(buyOrders.values()))
                .asks(viewOf(sellOrders.values()))
                .bestBid(getBestBid())
                .bestAsk(getBestAsk())
                .spread(getSpread())
                .timestamp(LocalDateTime.now())
                .build();
    }

    private ConcurrentSkipListMap<OrderKey, Order> sideOf(OrderSide side) {
        return side == OrderSide.BUY ? buyOrders : sellOrders;
    }

    private List<OrderBookSnapshot.RestingOrderView> viewOf(Collection<Order> orders) {
        List<OrderBookSnapshot.RestingOrderView> views = new ArrayList<>();
        for (Order order : orders) {
            views.add(OrderBookSnapshot.RestingOrderView.builder()
                    .orderId(order.getOrderId())
                    .price(order.getPrice())
                    .amount(order.getRemainingAmount())
                    .createdAt(order.getCreatedAt())
                    .build());
        }
        return views;
    }
}
