package com.flagship.revenue_ledger.ledger.event;

import com.flagship.revenue_ledger.ledger.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class JournalEntryVoidedEvent implements LedgerEvent {
    UUID eventId;
    UUID organizationId;
    UUID journalEntryId;
    String entryNumber;
    LocalDate voidedAt;
    String voidedBy;
    String voidReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryVoided";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalEntryVoidedEvent fromEntry(JournalEntry entry) {
        return new JournalEntryVoidedEvent(
            UUID.randomUUID(),
            entry.getOrganizationId(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getVoidedAt(),
            entry.getVoidedBy(),
            entry.getVoidReason(),
            Instant.now()
        );
    }
}
