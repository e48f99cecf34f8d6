package com.flagship.revenue_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One debit or credit of a journal entry. Line numbers start at 1 and have no gaps.
 */
@Value
@Builder(toBuilder = true)
public class JournalLine {
    UUID id;
    UUID journalEntryId;
    int lineNumber;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    String department;
    String project;
    String classification;
    String location;
}
