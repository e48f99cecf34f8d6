package com.flagship.revenue_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table to be published.
 *
 * Written in the same transaction as the state change it describes, so an
 * event exists if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;

    static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            Instant.now(), null, 0, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
