package com.flagship.revenue_ledger.outbox;

import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Polls the outbox and publishes ledger events to Kafka.
 *
 * Events are keyed by aggregate id so all events of one journal entry or
 * contract land on the same partition in commit order. Each send is awaited
 * before the event is marked published. After {@code max-retries} failed
 * attempts an event is no longer claimed and shows up as dead-lettered in
 * metrics and health.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final LedgerMetrics metrics;

    @Value("${kafka.topic.journal-entries:ledger.journal-entries}")
    private String journalEntriesTopic;

    @Value("${kafka.topic.contracts:ledger.contracts}")
    private String contractsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPending() {
        List<OutboxEvent> events;
        try {
            events = outboxService.claimUnpublished(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox", e);
            return;
        }
        events.forEach(this::publish);
    }

    private void publish(OutboxEvent event) {
        try {
            String topic = topicFor(event.getAggregateType());
            SendResult<String, String> result =
                kafkaTemplate.send(topic, event.getAggregateId().toString(), event.getPayload()).get();
            outboxService.markPublished(event.getId());
            metrics.recordOutboxPublished(event.getEventType());
            log.debug("Published {} for {} to {}-{}@{}", event.getEventType(), event.getAggregateId(),
                topic, result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            metrics.recordOutboxFailed(event.getEventType());
        } catch (ExecutionException | RuntimeException e) {
            outboxService.markFailed(event.getId(), e.getMessage());
            metrics.recordOutboxFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Outbox event {} ({}) reached {} attempts and is dead-lettered",
                    event.getId(), event.getEventType(), maxRetries);
            }
        }
    }

    String topicFor(String aggregateType) {
        return switch (aggregateType) {
            case LedgerAggregates.JOURNAL_ENTRY -> journalEntriesTopic;
            case LedgerAggregates.CONTRACT -> contractsTopic;
            default -> throw new IllegalArgumentException("No topic for aggregate type " + aggregateType);
        };
    }
}
