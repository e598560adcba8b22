package cex.spot.matching.service;

import cex.spot.matching.domain.Trade;
import cex.spot.matching.exception.PersistenceFailureException;
import cex.spot.matching.mapper.TradeMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for Trade entity management
 * Handles trade recording and queries
 */
@Slf4j
@Service
public class TradeService {

    /**
     * Upper bound for recent trade queries
     */
    public static final int MAX_RECENT_TRADES = 500;

    @Autowired
    private TradeMapper tradeMapper;

    /**
     * Create and persist a new trade
     *
     * @param trade the trade to create
     * @return the created trade with generated ID
     * @throws PersistenceFailureException if no row was inserted
     */
    public Trade createTrade(Trade trade) {
        if (trade.getCreatedAt() == null) {
            trade.setCreatedAt(LocalDateTime.now());
        }

        int result = tradeMapper.insert(trade);
        if (result <= 0) {
            throw new PersistenceFailureException("Failed to create trade: buyOrderId="
                    + trade.getBuyOrderId() + ", sellOrderId=" + trade.getSellOrderId());
        }

        log.info("Trade created: tradeId={}, buyOrderId={}, sellOrderId={}, symbol={}, price={}, amount={}",
                trade.getTradeId(), trade.getBuyOrderId(), trade.getSellOrderId(),
                trade.getSymbol(), trade.getPrice(), trade.getAmount());
        return trade;
    }

    /**
     * Get trade by ID
     *
     * @param tradeId the trade ID
     * @return the trade, or null if not found
     */
    public Trade getTradeById(Long tradeId) {
        return tradeMapper.findById(tradeId);
    }

    /**
     * Get all trades for a specific order in execution order
     *
     * @param orderId the order ID (can be buy or sell order)
     * @return list of trades
     */
    public List<Trade> getTradesByOrderId(Long orderId) {
        return tradeMapper.findByOrderId(orderId);
    }

    /**
     * Get the most recent trades of a symbol, newest first
     *
     * @param symbol the trading symbol
     * @param limit maximum number of trades, capped at MAX_RECENT_TRADES
     * @return list of trades
     */
    public List<Trade> getRecentTrades(String symbol, int limit) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_RECENT_TRADES));
        return tradeMapper.findRecentBySymbol(symbol, boundedLimit);
    }
}
