package cex.spot.matching.mapper;

import cex.spot.matching.domain.Trade;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper interface for Trade entity
 */
@Mapper
public interface TradeMapper {

    /**
     * Insert a new trade, populating the generated tradeId
     * @param trade the trade to insert
     * @return number of rows affected
     */
    int insert(Trade trade);

    /**
     * Find trade by ID
     * @param tradeId the trade ID
     * @return the trade, or null if not found
     */
    Trade findById(@Param("tradeId") Long tradeId);

    /**
     * Find all trades by order ID in execution order
     * @param orderId the order ID (can be buy or sell order)
     * @return list of trades
     */
    List<Trade> findByOrderId(@Param("orderId") Long orderId);

    /**
     * Find the most recent trades of a symbol, newest first
     * @param symbol the trading symbol
     * @param limit maximum number of trades
     * @return list of trades
     */
    List<Trade> findRecentBySymbol(@Param("symbol") String symbol, @Param("limit") int limit);
}
