package cex.spot.matching.strategy;

import cex.spot.matching.domain.Order;
import cex.spot.matching.domain.OrderBook;
import cex.spot.matching.domain.OrderBookStats;
import cex.spot.matching.domain.Trade;
import cex.spot.matching.dto.MatchResult;
import cex.spot.matching.enums.OrderSide;
import cex.spot.matching.enums.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Matching strategy for LIMIT orders
 * Implements price-time priority: best price first, then earliest creation within a price
 */
@Slf4j
@Component
public class LimitOrderMatchingStrategy implements OrderMatchingStrategy {

    @Override
    public MatchResult match(Order incomingOrder, OrderBook orderBook, FillHandler fillHandler) {
        log.debug("Matching LIMIT order: orderId={} {} {} @ {} amount={}",
                incomingOrder.getOrderId(), incomingOrder.getSide(), incomingOrder.getSymbol(),
                incomingOrder.getPrice(), incomingOrder.getAmount());

        List<Trade> trades = new ArrayList<>();
        List<Order> modifiedOrders = new ArrayList<>();
        String failureMessage = null;

        // Weakly consistent iterator over the opposite side, best price first
        Iterator<Order> candidates = orderBook.getRestingOrders(incomingOrder.getSide().opposite()).iterator();

        while (candidates.hasNext() && incomingOrder.getRemainingAmount().signum() > 0) {
            Order bookOrder = candidates.next();

            if (!crosses(incomingOrder, bookOrder)) {
                log.debug("No more matches: book price {} does not cross {} {}",
                        bookOrder.getPrice(), incomingOrder.getSide(), incomingOrder.getPrice());
                break;
            }

            try {
                Trade trade = executeFill(incomingOrder, bookOrder, orderBook, fillHandler);
                trades.add(trade);
                modifiedOrders.add(bookOrder);
            } catch (RuntimeException e) {
                failureMessage = e.getMessage();
                log.error("Fill persistence failed, aborting match: takerOrderId={}, makerOrderId={}, tradesCommitted={}, error={}",
                        incomingOrder.getOrderId(), bookOrder.getOrderId(), trades.size(), e.getMessage(), e);
                break;
            }
        }

        // Rest the remainder, also after an aborted match: it mirrors the last committed state
        if (incomingOrder.getRemainingAmount().signum() > 0) {
            orderBook.addRestingOrder(incomingOrder);
            log.debug("Added order {} to book at price {}: remaining amount={}",
                    incomingOrder.getOrderId(), incomingOrder.getPrice(), incomingOrder.getRemainingAmount());
        }

        boolean fullyMatched = incomingOrder.isFilled();

        log.info("LIMIT order match complete: orderId={}, status={}, filled={}/{}, trades={}",
                incomingOrder.getOrderId(), incomingOrder.getStatus(),
                incomingOrder.getFilledAmount(), incomingOrder.getAmount(),
                trades.size());

        return MatchResult.builder()
                .updatedOrder(incomingOrder)
                .trades(trades)
                .modifiedOrders(modifiedOrders)
                .fullyMatched(fullyMatched)
                .persistenceFailure(failureMessage != null)
                .failureMessage(failureMessage)
                .build();
    }

    /**
     * A buy crosses asks priced at or below it, a sell crosses bids priced at or above it
     */
    private boolean crosses(Order incomingOrder, Order bookOrder) {
        int comparison = bookOrder.getPrice().compareTo(incomingOrder.getPrice());
        return incomingOrder.getSide() == OrderSide.BUY ? comparison <= 0 : comparison >= 0;
    }

    /**
     * Apply one fill in memory, hand it to the FillHandler, then commit it to the book.
     * If the handler throws, both orders are restored and the book is left untouched.
     */
    private Trade executeFill(Order incomingOrder, Order bookOrder, OrderBook orderBook, FillHandler fillHandler) {
        // Maker sets the price
        BigDecimal matchPrice = bookOrder.getPrice();
        BigDecimal matchAmount = incomingOrder.getRemainingAmount().min(bookOrder.getRemainingAmount());
        boolean incomingIsBuy = incomingOrder.getSide() == OrderSide.BUY;
        Order buyOrder = incomingIsBuy ? incomingOrder : bookOrder;
        Order sellOrder = incomingIsBuy ? bookOrder : incomingOrder;

        log.debug("Matching {} with {} at price {}: amount={}",
                incomingOrder.getOrderId(), bookOrder.getOrderId(), matchPrice, matchAmount);

        Trade trade = Trade.builder()
                .symbol(incomingOrder.getSymbol())
                .price(matchPrice)
                .amount(matchAmount)
                .buyerUserId(buyOrder.getUserId())
                .sellerUserId(sellOrder.getUserId())
                .buyOrderId(buyOrder.getOrderId())
                .sellOrderId(sellOrder.getOrderId())
                .takerOrderId(incomingOrder.getOrderId())
                .createdAt(LocalDateTime.now())
                .build();

        FillCheckpoint takerCheckpoint = FillCheckpoint.of(incomingOrder);
        FillCheckpoint makerCheckpoint = FillCheckpoint.of(bookOrder);
        OrderBookStats nextStats = orderBook.getStats().afterTrade(matchPrice, matchAmount);

        incomingOrder.applyFill(matchAmount);
        bookOrder.applyFill(matchAmount);

        try {
            fillHandler.onFill(new Fill(trade, incomingOrder, bookOrder, nextStats));
        } catch (RuntimeException e) {
            takerCheckpoint.restore(incomingOrder);
            makerCheckpoint.restore(bookOrder);
            throw e;
        }

        orderBook.applyStats(nextStats);
        if (bookOrder.isFilled()) {
            orderBook.removeRestingOrder(bookOrder);
            log.debug("Book order {} fully filled and removed", bookOrder.getOrderId());
        } else {
            log.debug("Book order {} partially filled: {}/{}",
                    bookOrder.getOrderId(), bookOrder.getFilledAmount(), bookOrder.getAmount());
        }
        return trade;
    }

    /**
     * Fill state of an order before a match step
     */
    private static final class FillCheckpoint {
        private final BigDecimal filledAmount;
        private final OrderStatus status;
        private final LocalDateTime updatedAt;

        private FillCheckpoint(BigDecimal filledAmount, OrderStatus status, LocalDateTime updatedAt) {
            this.filledAmount = filledAmount;
            this.status = status;
            this.updatedAt = updatedAt;
        }

        static FillCheckpoint of(Order order) {
            return new FillCheckpoint(order.getFilledAmount(), order.getStatus(), order.getUpdatedAt());
        }

        void restore(Order order) {
            order.setFilledAmount(filledAmount);
            order.setStatus(status);
            order.setUpdatedAt(updatedAt);
        }
    }
}
