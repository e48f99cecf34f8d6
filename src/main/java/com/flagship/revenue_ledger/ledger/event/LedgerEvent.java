package com.flagship.revenue_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of events written to the outbox by the ledger.
 */
public interface LedgerEvent {

    /** Unique per event instance; consumers deduplicate on it. */
    UUID getEventId();

    UUID getOrganizationId();

    Instant getOccurredAt();

    String getEventType();
}
