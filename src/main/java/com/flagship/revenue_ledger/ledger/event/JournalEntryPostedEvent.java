package com.flagship.revenue_ledger.ledger.event;

import com.flagship.revenue_ledger.ledger.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a journal entry reaches POSTED, either through a manual post
 * or directly at creation by revenue recognition.
 */
@Value
public class JournalEntryPostedEvent implements LedgerEvent {
    UUID eventId;
    UUID organizationId;
    UUID journalEntryId;
    String entryNumber;
    LocalDate entryDate;
    BigDecimal amount;
    UUID revenueScheduleLineId;
    LocalDate postedAt;
    String postedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalEntryPostedEvent fromEntry(JournalEntry entry) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getOrganizationId(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getEntryDate(),
            entry.totalDebit(),
            entry.getRevenueScheduleLineId(),
            entry.getPostedAt(),
            entry.getPostedBy(),
            Instant.now()
        );
    }
}
