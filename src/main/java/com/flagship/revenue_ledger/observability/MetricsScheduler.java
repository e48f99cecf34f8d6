package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedDelayString = "${revenue-ledger.metrics.refresh-interval-ms:15000}")
    public void refreshOutboxGauges() {
        try {
            metrics.updateOutboxGauges(outboxService.countUnpublished(), outboxService.countDeadLettered(maxRetries));
        } catch (DataAccessException e) {
            log.warn("Could not refresh outbox gauges: {}", e.getMessage());
        }
    }
}
