package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Outbox health: DOWN while any event is dead-lettered, UNKNOWN when the
 * backlog passes the warning threshold, UP otherwise.
 */
@Component("outbox")
@RequiredArgsConstructor
public class OutboxHealthIndicator implements HealthIndicator {

    private final OutboxService outboxService;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.health.backlog-warning-threshold:1000}")
    private long backlogWarningThreshold;

    @Override
    public Health health() {
        long backlog = outboxService.countUnpublished();
        long deadLetters = outboxService.countDeadLettered(maxRetries);
        Health.Builder builder;
        if (deadLetters > 0) {
            builder = Health.down();
        } else if (backlog > backlogWarningThreshold) {
            builder = Health.unknown();
        } else {
            builder = Health.up();
        }
        return builder
            .withDetail("backlog", backlog)
            .withDetail("deadLetters", deadLetters)
            .withDetail("backlogWarningThreshold", backlogWarningThreshold)
            .build();
    }
}
