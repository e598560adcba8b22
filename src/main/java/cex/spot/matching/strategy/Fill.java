package cex.spot.matching.strategy;

import cex.spot.matching.domain.Order;
import cex.spot.matching.domain.OrderBookStats;
import cex.spot.matching.domain.Trade;
import lombok.Value;

/**
 * One match step: the new trade, both orders with the fill applied and the book aggregates after the trade
 */
@Value
public class Fill {

    Trade trade;

    /**
     * Incoming order
     */
    Order taker;

    /**
     * Resting order that set the price
     */
    Order maker;

    OrderBookStats stats;
}
