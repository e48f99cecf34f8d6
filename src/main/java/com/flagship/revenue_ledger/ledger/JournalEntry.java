package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.UnbalancedEntryException;
import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Domain model for a journal entry and its lines.
 *
 * Immutable; transitions return new instances and reject illegal moves with
 * {@link InvalidStateTransitionException}:
 * - {@link #post}: DRAFT only, lines required, debits must equal credits exactly
 * - {@link #voidEntry}: POSTED only, reason required
 * - {@link #requireDraft}: guard for edits and deletes
 *
 * Any entry that is not a draft is balanced.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID id;
    UUID organizationId;
    String entryNumber;
    LocalDate entryDate;
    String description;
    String reference;
    String sourceType;
    UUID sourceId;
    /** Set only on recognition entries; unique across the ledger. */
    UUID revenueScheduleLineId;
    JournalEntryStatus status;
    List<JournalLine> lines;
    LocalDate postedAt;
    String postedBy;
    LocalDate voidedAt;
    String voidedBy;
    String voidReason;
    Instant createdAt;

    public BigDecimal totalDebit() {
        return lines.stream().map(JournalLine::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCredit() {
        return lines.stream().map(JournalLine::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return totalDebit().compareTo(totalCredit()) == 0;
    }

    public JournalEntry post(LocalDate postedOn, String actor) {
        requireStatus(JournalEntryStatus.DRAFT, "post");
        if (lines.isEmpty()) {
            throw new ValidationException("Journal entry " + entryNumber + " has no lines", ids());
        }
        if (!isBalanced()) {
            throw new UnbalancedEntryException(
                String.format("Journal entry %s is not balanced: debits=%s, credits=%s",
                    entryNumber, totalDebit().toPlainString(), totalCredit().toPlainString()),
                ids());
        }
        return toBuilder()
            .status(JournalEntryStatus.POSTED)
            .postedAt(postedOn)
            .postedBy(actor)
            .build();
    }

    public JournalEntry voidEntry(LocalDate voidedOn, String actor, String reason) {
        requireStatus(JournalEntryStatus.POSTED, "void");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required to void journal entry " + entryNumber, ids());
        }
        return toBuilder()
            .status(JournalEntryStatus.VOIDED)
            .voidedAt(voidedOn)
            .voidedBy(actor)
            .voidReason(reason.trim())
            .build();
    }

    public void requireDraft(String action) {
        requireStatus(JournalEntryStatus.DRAFT, action);
    }

    private void requireStatus(JournalEntryStatus expected, String action) {
        if (status != expected) {
            throw new InvalidStateTransitionException(
                String.format("Cannot %s journal entry %s in %s status", action, entryNumber, status),
                ids());
        }
    }

    private Map<String, Object> ids() {
        return Map.of("journalEntryId", id);
    }
}
