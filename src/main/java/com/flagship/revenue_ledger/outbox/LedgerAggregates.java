package com.flagship.revenue_ledger.outbox;

/**
 * Aggregate type names written to {@code outbox_events.aggregate_type}.
 */
public final class LedgerAggregates {

    public static final String JOURNAL_ENTRY = "JournalEntry";
    public static final String CONTRACT = "Contract";

    private LedgerAggregates() {
    }
}
