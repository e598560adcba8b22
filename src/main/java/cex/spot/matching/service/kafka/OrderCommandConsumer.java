package cex.spot.matching.service.kafka;

import cex.spot.matching.dto.MatchResult;
import cex.spot.matching.event.OrderCommandEvent;
import cex.spot.matching.exception.InvalidOrderException;
import cex.spot.matching.service.MatchingEngineService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Service;

/**
 * Kafka consumer for order commands
 * Consumes PLACE / CANCEL commands from the order-input topic and hands them to the matching engine
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "matching.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class OrderCommandConsumer {

    @Autowired
    private MatchingEngineService matchingEngineService;

    @Autowired
    private IdempotencyService idempotencyService;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter commandsReceivedCounter;
    private Counter commandsRejectedCounter;
    private Counter commandsDuplicateCounter;

    /**
     * Initialize metrics on application startup
     */
    @PostConstruct
    public void initMetrics() {
        commandsReceivedCounter = Counter.builder("kafka.consumer.messages.received")
                .description("Total messages received by consumer")
                .tag("consumer", "order-command")
                .register(meterRegistry);

        commandsRejectedCounter = Counter.builder("kafka.consumer.messages.rejected")
                .description("Commands rejected as invalid and skipped")
                .tag("consumer", "order-command")
                .register(meterRegistry);

        commandsDuplicateCounter = Counter.builder("kafka.consumer.messages.duplicate")
                .description("Redelivered commands skipped as already processed")
                .tag("consumer", "order-command")
                .register(meterRegistry);
    }

    /**
     * Consume one command and process it through the matching engine
     *
     * Acknowledgment: Manual, after the engine returns and the messageId is recorded
     * Redelivered commands whose messageId is already recorded are skipped.
     * Invalid commands are logged and skipped; other failures are rethrown so the
     * container's error handler retries them (nothing is committed when placement fails)
     */
    @KafkaListener(
        topics = "${kafka.topics.order-input}",
        containerFactory = "orderCommandListenerContainerFactory"
    )
    public void consumeCommand(
            OrderCommandEvent event,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        commandsReceivedCounter.increment();
        log.info("Consumed order command: type={}, messageId={}, symbol={}, partition={}, offset={}",
                event.getType(), event.getMessageId(), event.getSymbol(), partition, offset);

        if (event.getMessageId() != null && idempotencyService.isMessageProcessed(event.getMessageId())) {
            commandsDuplicateCounter.increment();
            log.warn("Duplicate order command skipped: messageId={}, recordedOrderId={}",
                    event.getMessageId(), idempotencyService.findOrderId(event.getMessageId()));
            acknowledgment.acknowledge();
            return;
        }

        try {
            Long orderId = handle(event);
            markProcessed(event, orderId);
        } catch (InvalidOrderException e) {
            commandsRejectedCounter.increment();
            log.warn("Skipping invalid order command: messageId={}, error={}", event.getMessageId(), e.getMessage());
        }

        acknowledgment.acknowledge();
    }

    /**
     * Dispatch a command to the engine
     *
     * @param event the command
     * @return the order placed or targeted by the command
     * @throws InvalidOrderException if the command is malformed
     */
    public Long handle(OrderCommandEvent event) {
        if (event.getType() == null) {
            throw new InvalidOrderException("Command type is missing: messageId=" + event.getMessageId());
        }

        if (event.getType() == OrderCommandEvent.CommandType.PLACE) {
            if (event.getMessageId() == null || event.getMessageId().isBlank()) {
                throw new InvalidOrderException("PLACE command must carry a messageId");
            }
            MatchResult result = matchingEngineService.placeOrder(event.toOrder());
            log.info("Order command processed: messageId={}, orderId={}, status={}, trades={}, persistenceFailure={}",
                    event.getMessageId(), result.getUpdatedOrder().getOrderId(),
                    result.getUpdatedOrder().getStatus(), result.getTrades().size(),
                    result.isPersistenceFailure());
            return result.getUpdatedOrder().getOrderId();
        }

        boolean cancelled = matchingEngineService.cancelOrder(event.getOrderId(), event.getUserId());
        log.info("Cancel command processed: messageId={}, orderId={}, cancelled={}",
                event.getMessageId(), event.getOrderId(), cancelled);
        return event.getOrderId();
    }

    /**
     * Record the messageId once the engine has committed the command.
     * A Redis failure here is logged only: the command is done and must still be acknowledged.
     */
    private void markProcessed(OrderCommandEvent event, Long orderId) {
        if (event.getMessageId() == null) {
            return;
        }
        try {
            idempotencyService.markMessageProcessed(event.getMessageId(), orderId);
        } catch (RuntimeException e) {
            log.error("Failed to record processed command, a redelivery would be processed again: messageId={}, orderId={}, error={}",
                    event.getMessageId(), orderId, e.getMessage(), e);
        }
    }
}
