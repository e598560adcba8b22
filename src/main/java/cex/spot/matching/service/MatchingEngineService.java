package cex.spot.matching.service;

import cex.spot.matching.domain.Order;
import cex.spot.matching.domain.OrderBook;
import cex.spot.matching.domain.Trade;
import cex.spot.matching.dto.MatchResult;
import cex.spot.matching.dto.OrderBookSnapshot;
import cex.spot.matching.enums.OrderStatus;
import cex.spot.matching.event.OrderBookUpdatedEvent;
import cex.spot.matching.exception.InvalidOrderException;
import cex.spot.matching.exception.PersistenceFailureException;
import cex.spot.matching.service.cache.OrderBookCacheService;
import cex.spot.matching.service.event.MatchEventPublisher;
import cex.spot.matching.strategy.OrderMatchingStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Core matching engine service
 * The only component that mutates orders, trades and order books.
 * Place and cancel run under the symbol lock; reads never take it.
 */
@Slf4j
@Service
public class MatchingEngineService {

    /**
     * Fractional digits stored by the DECIMAL(36, 18) price and amount columns
     */
    static final int MAX_SCALE = 18;

    /**
     * Integer digits stored by the DECIMAL(36, 18) price and amount columns
     */
    static final int MAX_INTEGER_DIGITS = 18;

    @Autowired
    private OrderMatchingStrategy matchingStrategy;

    @Autowired
    private OrderService orderService;

    @Autowired
    private TradeService tradeService;

    @Autowired
    private OrderBookService orderBookService;

    @Autowired
    private MatchPersistenceService matchPersistenceService;

    @Autowired
    private SymbolLockRegistry lockRegistry;

    @Autowired
    private MatchEventPublisher eventPublisher;

    @Autowired
    private OrderBookCacheService orderBookCacheService;

    @Autowired
    private MeterRegistry meterRegistry;

    /**
     * Symbols accepted by the engine
     */
    @Value("${matching.symbols}")
    private Set<String> supportedSymbols;

    private Timer placeTimer;
    private Timer cancelTimer;
    private Counter ordersPlacedCounter;
    private Counter ordersRejectedCounter;
    private Counter ordersCancelledCounter;
    private Counter persistenceFailureCounter;

    /**
     * Initialize metrics on application startup
     */
    @PostConstruct
    public void initMetrics() {
        placeTimer = Timer.builder("matching.place.time")
                .description("Time taken to place and match an order, lock wait included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        cancelTimer = Timer.builder("matching.cancel.time")
                .description("Time taken to cancel an order, lock wait included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        ordersPlacedCounter = Counter.builder("matching.orders.placed")
                .description("Orders accepted and persisted")
                .register(meterRegistry);

        ordersRejectedCounter = Counter.builder("matching.orders.rejected")
                .description("Orders rejected by validation")
                .register(meterRegistry);

        ordersCancelledCounter = Counter.builder("matching.orders.cancelled")
                .description("Orders cancelled")
                .register(meterRegistry);

        persistenceFailureCounter = Counter.builder("matching.persistence.failures")
                .description("Matches aborted because a fill could not be persisted")
                .register(meterRegistry);

        log.info("Matching engine initialized: symbols={}", supportedSymbols);
    }

    /**
     * Place a new limit order and match it against the opposite side of its book
     *
     * Each fill is persisted in its own transaction. If one fails, matching stops and the result
     * lists the trades committed so far with persistenceFailure set; the remainder still rests.
     *
     * @param order the new order (no id, PENDING or no status, nothing filled)
     * @return MatchResult containing the updated order, trades and modified resting orders
     * @throws InvalidOrderException if the order is malformed or the symbol is unknown
     * @throws PersistenceFailureException if the order itself cannot be stored
     */
    public MatchResult placeOrder(Order order) {
        validateNewOrder(order);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return lockRegistry.executeWithLock(order.getSymbol(), () -> doPlaceOrder(order));
        } finally {
            sample.stop(placeTimer);
        }
    }

    /**
     * Cancel a resting order
     *
     * @param orderId the order to cancel
     * @param userId the requesting user
     * @return true if the order was cancelled; false if it is unknown, owned by another user or already terminal
     * @throws PersistenceFailureException if the cancellation cannot be stored
     */
    public boolean cancelOrder(Long orderId, Long userId) {
        Order order = orderService.getOrderById(orderId);
        if (order == null || userId == null || !userId.equals(order.getUserId())) {
            log.debug("Cancel rejected, order not found for user: orderId={}, userId={}", orderId, userId);
            return false;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return lockRegistry.executeWithLock(order.getSymbol(), () -> doCancelOrder(orderId, order.getSymbol()));
        } finally {
            sample.stop(cancelTimer);
        }
    }

    /**
     * Current order book of a symbol. Eventually consistent: served from cache when fresh,
     * otherwise built from the in-memory book without taking the symbol lock.
     *
     * @param symbol the trading symbol
     * @return order book snapshot
     * @throws InvalidOrderException if the symbol is unknown
     */
    public OrderBookSnapshot getOrderBook(String symbol) {
        validateSymbol(symbol);

        OrderBookSnapshot cached = orderBookCacheService.get(symbol);
        if (cached != null) {
            return cached;
        }

        OrderBook orderBook = orderBookService.getLoadedOrderBook(symbol);
        if (orderBook == null) {
            orderBook = loadPersistedAggregates(symbol);
        }

        OrderBookSnapshot snapshot = orderBook.snapshot();
        orderBookCacheService.put(snapshot);
        return snapshot;
    }

    /**
     * Get order by ID
     *
     * @param orderId the order ID
     * @return the persisted order, or null if not found
     */
    public Order getOrder(Long orderId) {
        return orderService.getOrderById(orderId);
    }

    /**
     * Trades an order took part in, in execution order
     *
     * @param orderId the order ID (buy or sell side)
     * @return list of trades
     */
    public List<Trade> getTradesByOrderId(Long orderId) {
        return tradeService.getTradesByOrderId(orderId);
    }

    /**
     * Most recent trades of a symbol, newest first
     *
     * @param symbol the trading symbol
     * @param limit maximum number of trades
     * @return list of trades
     * @throws InvalidOrderException if the symbol is unknown
     */
    public List<Trade> getRecentTrades(String symbol, int limit) {
        validateSymbol(symbol);
        return tradeService.getRecentTrades(symbol, limit);
    }

    /**
     * Load the book of a symbol into memory, rebuilding its resting orders
     *
     * @param symbol the trading symbol
     * @return number of resting orders in the book
     */
    public int loadOrderBook(String symbol) {
        validateSymbol(symbol);
        return lockRegistry.executeWithLock(symbol, () -> {
            OrderBook orderBook = orderBookService.getOrCreateOrderBook(symbol);
            return orderBook.getOrdersById().size();
        });
    }

    public boolean isSupportedSymbol(String symbol) {
        return symbol != null && supportedSymbols.contains(symbol);
    }

    private MatchResult doPlaceOrder(Order order) {
        OrderBook orderBook;
        try {
            // Book first: a lazy rebuild must not pick up the order being placed
            orderBook = orderBookService.getOrCreateOrderBook(order.getSymbol());
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load order book: " + order.getSymbol(), e);
        }

        orderService.createOrder(order);
        ordersPlacedCounter.increment();

        log.info("Processing order through matching engine: orderId={}, userId={}, symbol={}, side={}, price={}, amount={}",
                order.getOrderId(), order.getUserId(), order.getSymbol(),
                order.getSide(), order.getPrice(), order.getAmount());

        MatchResult result = matchingStrategy.match(order, orderBook, fill -> {
            matchPersistenceService.recordFill(fill);
            eventPublisher.publishTrade(fill.getTrade());
        });

        if (result.isPersistenceFailure()) {
            persistenceFailureCounter.increment();
            log.error("Order partially processed after persistence failure: orderId={}, status={}, filled={}/{}, trades={}, error={}",
                    order.getOrderId(), order.getStatus(), order.getFilledAmount(), order.getAmount(),
                    result.getTrades().size(), result.getFailureMessage());
        } else {
            log.info("Order processing complete: orderId={}, status={}, filled={}/{}, trades={}, fullyMatched={}",
                    order.getOrderId(), order.getStatus(), order.getFilledAmount(), order.getAmount(),
                    result.getTrades().size(), result.isFullyMatched());
        }

        eventPublisher.publishOrderBook(orderBook.snapshot(), OrderBookUpdatedEvent.Reason.ORDER_PLACED,
                order.getOrderId());
        return result;
    }

    private boolean doCancelOrder(Long orderId, String symbol) {
        OrderBook orderBook;
        try {
            orderBook = orderBookService.getOrCreateOrderBook(symbol);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load order book: " + symbol, e);
        }

        // Re-read under the lock: a match may have filled the order since the ownership check
        Order order = orderBook.getRestingOrder(orderId);
        if (order == null) {
            order = orderService.getOrderById(orderId);
        }
        if (order == null || order.getStatus().isTerminal()) {
            log.debug("Cancel ignored, order is terminal: orderId={}, status={}",
                    orderId, order == null ? null : order.getStatus());
            return false;
        }

        OrderStatus previousStatus = order.getStatus();
        LocalDateTime previousUpdatedAt = order.getUpdatedAt();
        order.setStatus(OrderStatus.CANCELLED);
        order.setUpdatedAt(LocalDateTime.now());

        try {
            orderService.updateOrder(order);
        } catch (RuntimeException e) {
            order.setStatus(previousStatus);
            order.setUpdatedAt(previousUpdatedAt);
            log.error("Failed to persist cancellation: orderId={}, error={}", orderId, e.getMessage(), e);
            if (e instanceof PersistenceFailureException) {
                throw e;
            }
            throw new PersistenceFailureException("Failed to cancel order: " + orderId, e);
        }

        orderBook.removeRestingOrder(order);
        ordersCancelledCounter.increment();
        log.info("Order cancelled: orderId={}, userId={}, symbol={}, filled={}/{}",
                orderId, order.getUserId(), symbol, order.getFilledAmount(), order.getAmount());

        eventPublisher.publishOrderBook(orderBook.snapshot(), OrderBookUpdatedEvent.Reason.ORDER_CANCELLED, orderId);
        return true;
    }

    private OrderBook loadPersistedAggregates(String symbol) {
        OrderBook persisted;
        try {
            persisted = orderBookService.getPersistedOrderBook(symbol);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to read order book: " + symbol, e);
        }
        return persisted != null ? persisted : OrderBook.empty(symbol);
    }

    private void validateNewOrder(Order order) {
        try {
            if (order == null) {
                throw new InvalidOrderException("Order must not be null");
            }
            if (order.getOrderId() != null) {
                throw new InvalidOrderException("New order must not carry an orderId: " + order.getOrderId());
            }
            if (order.getUserId() == null) {
                throw new InvalidOrderException("Order must specify userId");
            }
            validateSymbol(order.getSymbol());
            if (order.getSide() == null) {
                throw new InvalidOrderException("Order must specify side");
            }
            if (order.getPrice() == null || order.getPrice().signum() <= 0) {
                throw new InvalidOrderException("Price must be positive: " + order.getPrice());
            }
            if (order.getAmount() == null || order.getAmount().signum() <= 0) {
                throw new InvalidOrderException("Amount must be positive: " + order.getAmount());
            }
            validateStorable("Price", order.getPrice());
            validateStorable("Amount", order.getAmount());
            if (order.getStatus() != null && order.getStatus() != OrderStatus.PENDING) {
                throw new InvalidOrderException("New order must be PENDING: " + order.getStatus());
            }
            if (order.getFilledAmount() != null && order.getFilledAmount().signum() != 0) {
                throw new InvalidOrderException("New order must not be filled: " + order.getFilledAmount());
            }
        } catch (InvalidOrderException e) {
            ordersRejectedCounter.increment();
            log.warn("Order rejected: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Reject values the store would round, so memory and database never disagree
     */
    private void validateStorable(String field, BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > MAX_SCALE) {
            throw new InvalidOrderException(field + " has more than " + MAX_SCALE + " decimal places: "
                    + value.toPlainString());
        }
        if (stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            throw new InvalidOrderException(field + " has more than " + MAX_INTEGER_DIGITS + " integer digits: "
                    + value.toPlainString());
        }
    }

    private void validateSymbol(String symbol) {
        if (!isSupportedSymbol(symbol)) {
            throw new InvalidOrderException("Unknown symbol: " + symbol);
        }
    }
}
