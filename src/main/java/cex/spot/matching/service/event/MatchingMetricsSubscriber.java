package cex.spot.matching.service.event;

import cex.spot.matching.event.TradeExecutedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Counts trades and traded amount per symbol
 */
@Component
public class MatchingMetricsSubscriber implements MatchEventSubscriber {

    @Autowired
    private MeterRegistry meterRegistry;

    @Override
    public void onTradeExecuted(TradeExecutedEvent event) {
        Counter.builder("matching.trades.executed")
                .description("Total trades executed")
                .tag("symbol", event.getSymbol())
                .register(meterRegistry)
                .increment();

        DistributionSummary.builder("matching.trades.amount")
                .description("Executed amount per trade")
                .tag("symbol", event.getSymbol())
                .register(meterRegistry)
                .record(event.getAmount().doubleValue());
    }
}
