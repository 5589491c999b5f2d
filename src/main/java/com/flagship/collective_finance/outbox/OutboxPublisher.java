package com.flagship.collective_finance.outbox;

import com.flagship.collective_finance.notification.NotificationDispatcher;
import com.flagship.collective_finance.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background publisher that drains the outbox into Kafka.
 *
 * <p>Each polled event is sent synchronously with its aggregate id as the
 * record key, then marked published. A failed send only bumps the retry
 * counter; the mutation that queued the event has long since committed and
 * is never affected. Events that reach {@code outbox.publisher.max-retries}
 * stop being polled and are counted as dead letters.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.notifications:collective-notifications}")
    private String notificationsTopic;

    @Value("${kafka.topic.default:collective-events}")
    private String defaultTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.claimBatch(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            events.forEach(this::publish);
        } catch (Exception e) {
            log.error("Outbox polling failed", e);
        }
    }

    void publish(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId().toString(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published outbox event: eventId={}, topic={}, offset={}, eventType={}",
                    event.getId(), topic, result.getRecordMetadata().offset(), event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (Exception e) {
            recordFailure(event, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Failed to publish outbox event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Outbox event {} dead-lettered after {} attempts", event.getId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    private String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case NotificationDispatcher.AGGREGATE_TYPE -> notificationsTopic;
            default -> defaultTopic;
        };
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
