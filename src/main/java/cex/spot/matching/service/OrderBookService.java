package cex.spot.matching.service;

import cex.spot.matching.domain.Order;
import cex.spot.matching.domain.OrderBook;
import cex.spot.matching.mapper.OrderBookMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for OrderBook entity management
 * Owns the in-memory books (one per symbol) and their persisted aggregate rows
 */
@Slf4j
@Service
public class OrderBookService {

    private final Map<String, OrderBook> orderBooks = new ConcurrentHashMap<>();

    @Autowired
    private OrderBookMapper orderBookMapper;

    @Autowired
    private OrderService orderService;

    /**
     * Rebuild resting orders from the store when a book is first loaded
     */
    @Value("${matching.recovery.enabled:true}")
    private boolean recoveryEnabled;

    /**
     * Get or lazily create the in-memory order book of a symbol.
     * Must be called with the symbol lock held.
     *
     * @param symbol the trading symbol
     * @return the order book
     */
    public OrderBook getOrCreateOrderBook(String symbol) {
        OrderBook orderBook = orderBooks.get(symbol);
        if (orderBook != null) {
            return orderBook;
        }

        orderBook = orderBookMapper.findBySymbol(symbol);
        if (orderBook == null) {
            orderBook = OrderBook.empty(symbol);
            orderBookMapper.insert(orderBook);
            log.info("Created new order book for symbol: {}", symbol);
        }
        if (recoveryEnabled) {
            restoreRestingOrders(orderBook);
        }

        orderBooks.put(symbol, orderBook);
        return orderBook;
    }

    /**
     * In-memory order book of a symbol, or null if it has not been loaded
     *
     * @param symbol the trading symbol
     * @return the order book, or null
     */
    public OrderBook getLoadedOrderBook(String symbol) {
        return orderBooks.get(symbol);
    }

    /**
     * Persisted aggregates of a symbol without resting orders, or null if the symbol never traded
     *
     * @param symbol the trading symbol
     * @return the order book row, or null
     */
    public OrderBook getPersistedOrderBook(String symbol) {
        return orderBookMapper.findBySymbol(symbol);
    }

    /**
     * All persisted order book rows
     */
    public List<OrderBook> getPersistedOrderBooks() {
        return orderBookMapper.findAll();
    }

    /**
     * Symbols whose books are loaded in memory
     */
    public Collection<String> getLoadedSymbols() {
        return Collections.unmodifiableSet(orderBooks.keySet());
    }

    /**
     * Add persisted PENDING and PARTIALLY_FILLED orders in creation order
     */
    private void restoreRestingOrders(OrderBook orderBook) {
        List<Order> restingOrders = orderService.getRestingOrders(orderBook.getSymbol());
        for (Order order : restingOrders) {
            orderBook.addRestingOrder(order);
        }
        log.info("Restored order book: symbol={}, restingOrders={}, bestBid={}, bestAsk={}",
                orderBook.getSymbol(), restingOrders.size(), orderBook.getBestBid(), orderBook.getBestAsk());
    }
}
