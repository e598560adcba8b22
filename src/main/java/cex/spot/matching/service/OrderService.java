package cex.spot.matching.service;

import cex.spot.matching.domain.Order;
import cex.spot.matching.enums.OrderStatus;
import cex.spot.matching.exception.PersistenceFailureException;
import cex.spot.matching.mapper.OrderMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for Order entity management
 * Handles order persistence and queries; all mutations come from the matching engine
 */
@Slf4j
@Service
public class OrderService {

    @Autowired
    private OrderMapper orderMapper;

    /**
     * Create a new order
     * Assigns PENDING status, zero fill and the creation timestamp used for time priority
     *
     * @param order the order to create
     * @return the created order with generated ID
     * @throws PersistenceFailureException if the order cannot be stored
     */
    public Order createOrder(Order order) {
        LocalDateTime now = LocalDateTime.now();
        order.setCreatedAt(now);
        order.setUpdatedAt(now);
        order.setFilledAmount(BigDecimal.ZERO);
        order.setStatus(OrderStatus.PENDING);

        int result;
        try {
            result = orderMapper.insert(order);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to create order: " + e.getMessage(), e);
        }
        if (result <= 0) {
            throw new PersistenceFailureException("Failed to create order for user " + order.getUserId());
        }

        log.info("Order created: orderId={}, userId={}, symbol={}, side={}, price={}, amount={}",
                order.getOrderId(), order.getUserId(), order.getSymbol(),
                order.getSide(), order.getPrice(), order.getAmount());
        return order;
    }

    /**
     * Persist fill state and status of an existing order
     *
     * @param order the order to update
     * @return the updated order
     * @throws PersistenceFailureException if no row was updated
     */
    public Order updateOrder(Order order) {
        int result = orderMapper.update(order);
        if (result <= 0) {
            throw new PersistenceFailureException("Failed to update order: orderId=" + order.getOrderId());
        }

        log.debug("Order updated: orderId={}, status={}, filled={}/{}",
                order.getOrderId(), order.getStatus(),
                order.getFilledAmount(), order.getAmount());
        return order;
    }

    /**
     * Get order by ID
     *
     * @param orderId the order ID
     * @return the order, or null if not found
     */
    public Order getOrderById(Long orderId) {
        if (orderId == null) {
            return null;
        }
        return orderMapper.findById(orderId);
    }

    /**
     * Get all orders by user ID, newest first
     *
     * @param userId the user ID
     * @return list of orders
     */
    public List<Order> getOrdersByUserId(Long userId) {
        return orderMapper.findByUserId(userId);
    }

    /**
     * Get PENDING and PARTIALLY_FILLED orders of a symbol in creation order
     *
     * @param symbol the trading symbol
     * @return list of resting orders
     */
    public List<Order> getRestingOrders(String symbol) {
        return orderMapper.findRestingBySymbol(symbol);
    }

    /**
     * Symbols with at least one persisted resting order
     */
    public List<String> getRestingSymbols() {
        return orderMapper.findRestingSymbols();
    }
}
