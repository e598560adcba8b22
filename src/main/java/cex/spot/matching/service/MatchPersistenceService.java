package cex.spot.matching.service;

import cex.spot.matching.exception.PersistenceFailureException;
import cex.spot.matching.mapper.OrderBookMapper;
import cex.spot.matching.strategy.Fill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists one fill atomically
 * Each fill gets its own local transaction: a failure rolls back that fill only,
 * earlier fills of the same order stay committed
 */
@Slf4j
@Service
public class MatchPersistenceService {

    @Autowired
    private OrderService orderService;

    @Autowired
    private TradeService tradeService;

    @Autowired
    private OrderBookMapper orderBookMapper;

    /**
     * Store the trade, both order updates and the book aggregates
     *
     * @param fill the fill to persist; the trade receives its generated ID
     * @throws PersistenceFailureException or a DataAccessException if any write fails
     */
    @Transactional(rollbackFor = Exception.class)
    public void recordFill(Fill fill) {
        tradeService.createTrade(fill.getTrade());
        orderService.updateOrder(fill.getTaker());
        orderService.updateOrder(fill.getMaker());

        int updated = orderBookMapper.updateStats(fill.getTrade().getSymbol(), fill.getStats());
        if (updated <= 0) {
            throw new PersistenceFailureException("Failed to update order book stats: symbol="
                    + fill.getTrade().getSymbol());
        }

        log.debug("Fill recorded: tradeId={}, takerOrderId={}, makerOrderId={}",
                fill.getTrade().getTradeId(), fill.getTaker().getOrderId(), fill.getMaker().getOrderId());
    }
}
