package cex.spot.matching.mapper;

import cex.spot.matching.domain.Order;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper interface for Order entity
 */
@Mapper
public interface OrderMapper {

    /**
     * Insert a new order, populating the generated orderId
     * @param order the order to insert
     * @return number of rows affected
     */
    int insert(Order order);

    /**
     * Update fill state and status of an existing order
     * @param order the order to update
     * @return number of rows affected
     */
    int update(Order order);

    /**
     * Find order by ID
     * @param orderId the order ID
     * @return the order, or null if not found
     */
    Order findById(@Param("orderId") Long orderId);

    /**
     * Find all orders by user ID, newest first
     * @param userId the user ID
     * @return list of orders
     */
    List<Order> findByUserId(@Param("userId") Long userId);

    /**
     * Find PENDING and PARTIALLY_FILLED orders of one symbol in creation order
     * @param symbol the trading symbol
     * @return list of resting orders
     */
    List<Order> findRestingBySymbol(@Param("symbol") String symbol);

    /**
     * Symbols that have at least one resting order
     * @return distinct symbols
     */
    List<String> findRestingSymbols();
}
