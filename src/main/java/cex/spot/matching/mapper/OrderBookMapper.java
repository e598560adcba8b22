package cex.spot.matching.mapper;

import cex.spot.matching.domain.OrderBook;
import cex.spot.matching.domain.OrderBookStats;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper interface for the persisted aggregates of an OrderBook
 */
@Mapper
public interface OrderBookMapper {

    /**
     * Insert a new order book row
     * @param orderBook the order book to insert
     * @return number of rows affected
     */
    int insert(OrderBook orderBook);

    /**
     * Update last price, 24h volume/high/low of an order book
     * @param symbol the trading symbol
     * @param stats the new aggregates
     * @return number of rows affected
     */
    int updateStats(@Param("symbol") String symbol, @Param("stats") OrderBookStats stats);

    /**
     * Find order book by symbol
     * @param symbol the trading symbol
     * @return the order book, or null if not found
     */
    OrderBook findBySymbol(@Param("symbol") String symbol);

    /**
     * Find all order books
     * @return list of all order books
     */
    List<OrderBook> findAll();
}
