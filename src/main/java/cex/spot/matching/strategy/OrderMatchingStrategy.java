package cex.spot.matching.strategy;

import cex.spot.matching.domain.Order;
import cex.spot.matching.domain.OrderBook;
import cex.spot.matching.dto.MatchResult;

/**
 * Strategy interface for order matching
 * Implementations are called with the symbol lock held and must not call back into the engine
 */
public interface OrderMatchingStrategy {
    /**
     * Execute order matching logic
     *
     * @param incomingOrder The persisted order to match against the order book
     * @param orderBook The current order book for the symbol
     * @param fillHandler Persists each fill before it becomes visible in the book
     * @return MatchResult containing updated order, trades, and modified orders
     */
    MatchResult match(Order incomingOrder, OrderBook orderBook, FillHandler fillHandler);
}
