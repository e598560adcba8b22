package cex.spot.matching.service.kafka;

import cex.spot.matching.event.OrderBookUpdatedEvent;
import cex.spot.matching.event.TradeExecutedEvent;
import cex.spot.matching.service.event.MatchEventSubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes matching events to Kafka
 * Partition key = symbol, so consumers see one symbol's events in engine order
 * send() is asynchronous; it only blocks on missing metadata or a full buffer,
 * for at most matching.kafka.producer.max-block-ms, after which the send fails
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "matching.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaMatchEventSubscriber implements MatchEventSubscriber {

    @Autowired
    private KafkaTemplate<String, TradeExecutedEvent> tradeKafkaTemplate;

    @Autowired
    private KafkaTemplate<String, OrderBookUpdatedEvent> orderBookKafkaTemplate;

    @Value("${kafka.topics.trade-output}")
    private String tradeOutputTopic;

    @Value("${kafka.topics.orderbook-output}")
    private String orderBookOutputTopic;

    /**
     * Publish trade event to the trade-output topic
     * Trades are already committed in the database when this is called
     */
    @Override
    public void onTradeExecuted(TradeExecutedEvent event) {
        log.debug("Publishing trade to Kafka: tradeId={}, symbol={}, buyOrderId={}, sellOrderId={}, price={}, amount={}",
                event.getTradeId(), event.getSymbol(), event.getBuyOrderId(),
                event.getSellOrderId(), event.getPrice(), event.getAmount());

        CompletableFuture<SendResult<String, TradeExecutedEvent>> future =
                tradeKafkaTemplate.send(tradeOutputTopic, event.getSymbol(), event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("Trade published successfully: tradeId={}, partition={}, offset={}",
                        event.getTradeId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish trade: tradeId={}, messageId={}, error={}",
                        event.getTradeId(), event.getMessageId(), ex.getMessage(), ex);
            }
        });
    }

    /**
     * Publish order book snapshot to the orderbook-output topic
     */
    @Override
    public void onOrderBookUpdated(OrderBookUpdatedEvent event) {
        CompletableFuture<SendResult<String, OrderBookUpdatedEvent>> future =
                orderBookKafkaTemplate.send(orderBookOutputTopic, event.getSymbol(), event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("Order book published: symbol={}, reason={}, partition={}, offset={}",
                        event.getSymbol(), event.getReason(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                log.warn("Failed to publish order book: symbol={}, messageId={}, error={}",
                        event.getSymbol(), event.getMessageId(), ex.getMessage());
            }
        });
    }
}
