package com.flagship.revenue_ledger.ledger;

/**
 * Journal entry lifecycle: {@code DRAFT -> POSTED -> VOIDED}.
 */
public enum JournalEntryStatus {
    /**
     * Being assembled. Lines may be replaced and the entry may be deleted.
     * No balance requirement yet.
     */
    DRAFT,

    /**
     * Balanced and booked. Entry and lines are immutable; the only legal
     * transition left is void.
     */
    POSTED,

    /**
     * Audit marker on a posted entry. Terminal. The entry is kept and its
     * amounts are not reversed; corrections are separate entries.
     */
    VOIDED
}
