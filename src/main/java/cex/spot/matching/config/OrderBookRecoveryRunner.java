package cex.spot.matching.config;

import cex.spot.matching.domain.OrderBook;
import cex.spot.matching.service.MatchingEngineService;
import cex.spot.matching.service.OrderBookService;
import cex.spot.matching.service.OrderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;

/**
 * Application startup runner for order book recovery.
 *
 * On application startup, this component:
 * 1. Collects symbols that have a persisted order book row or resting orders
 * 2. Loads each supported symbol's book, rebuilding resting orders in created_at, order_id order
 * 3. Logs symbols with resting orders that are no longer supported
 *
 * Execution order: 1 (runs early in startup sequence)
 */
@Slf4j
@Component
@Order(1)
@ConditionalOnProperty(name = "matching.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class OrderBookRecoveryRunner implements ApplicationRunner {

    @Autowired
    private MatchingEngineService matchingEngineService;

    @Autowired
    private OrderBookService orderBookService;

    @Autowired
    private OrderService orderService;

    /**
     * Run order book recovery on application startup.
     *
     * @param args Application arguments
     */
    @Override
    public void run(ApplicationArguments args) {
        log.info("=== Starting Order Book Recovery ===");

        Set<String> symbols = new TreeSet<>(orderService.getRestingSymbols());
        for (OrderBook orderBook : orderBookService.getPersistedOrderBooks()) {
            symbols.add(orderBook.getSymbol());
        }

        if (symbols.isEmpty()) {
            log.info("No order books found, nothing to recover");
            return;
        }

        int successCount = 0;
        int errorCount = 0;
        int restingCount = 0;

        for (String symbol : symbols) {
            if (!matchingEngineService.isSupportedSymbol(symbol)) {
                log.warn("Skipping recovery of unsupported symbol: {}", symbol);
                continue;
            }
            try {
                restingCount += matchingEngineService.loadOrderBook(symbol);
                successCount++;
            } catch (RuntimeException e) {
                log.error("Failed to recover order book: symbol={}, error={}", symbol, e.getMessage(), e);
                errorCount++;
                // Continue with next symbol, the book is rebuilt lazily on first use
            }
        }

        log.info("=== Order Book Recovery Complete: success={}, errors={}, restingOrders={} ===",
                successCount, errorCount, restingCount);
    }
}
