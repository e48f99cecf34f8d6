package com.flagship.revenue_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Caller-supplied journal line, before numbering. A null debit or credit means zero.
 */
@Value
@Builder
public class JournalLineDraft {
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    String department;
    String project;
    String classification;
    String location;

    public static JournalLineDraft debit(UUID accountId, BigDecimal amount, String description) {
        return JournalLineDraft.builder().accountId(accountId).debit(amount).description(description).build();
    }

    public static JournalLineDraft credit(UUID accountId, BigDecimal amount, String description) {
        return JournalLineDraft.builder().accountId(accountId).credit(amount).description(description).build();
    }
}
