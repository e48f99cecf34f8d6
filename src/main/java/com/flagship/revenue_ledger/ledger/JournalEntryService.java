package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.account.AccountService;
import com.flagship.revenue_ledger.common.Amounts;
import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.event.JournalEntryPostedEvent;
import com.flagship.revenue_ledger.ledger.event.JournalEntryVoidedEvent;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.outbox.LedgerAggregates;
import com.flagship.revenue_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Journal entry lifecycle.
 *
 * Key principles:
 * - Drafts are free-form: lines are validated one by one but the entry need not balance
 * - Posting requires debits == credits exactly at two decimals; nothing is rounded away
 * - Posted entries are immutable; the only move left is void, which keeps the entry
 * - Only drafts can be deleted; their number is not reused
 * - Every post and void writes an outbox event in the same transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryService {

    private final JournalPersistenceService persistenceService;
    private final EntryNumberSequence entryNumberSequence;
    private final AccountService accountService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public JournalEntry createDraft(UUID organizationId, LocalDate entryDate, String description,
                                    String reference, String sourceType, UUID sourceId,
                                    List<JournalLineDraft> lines) {
        if (organizationId == null) {
            throw new ValidationException("Organization is required");
        }
        if (entryDate == null) {
            throw new ValidationException("Entry date is required");
        }
        UUID entryId = UUID.randomUUID();
        List<JournalLine> validated = toLines(entryId, organizationId, lines);

        JournalEntry draft = JournalEntry.builder()
            .id(entryId)
            .organizationId(organizationId)
            .entryNumber(entryNumberSequence.next(organizationId))
            .entryDate(entryDate)
            .description(description)
            .reference(reference)
            .sourceType(sourceType)
            .sourceId(sourceId)
            .status(JournalEntryStatus.DRAFT)
            .lines(validated)
            .build();

        JournalEntry saved = persistenceService.create(draft);
        log.info("Created draft journal entry: journalEntryId={}, number={}, lines={}",
            saved.getId(), saved.getEntryNumber(), saved.getLines().size());
        return saved;
    }

    /**
     * Replaces date, description, reference and the full line set of a draft.
     */
    @Transactional
    public JournalEntry updateDraft(UUID entryId, LocalDate entryDate, String description,
                                    String reference, List<JournalLineDraft> lines) {
        JournalEntry existing = persistenceService.require(entryId);
        existing.requireDraft("update");
        if (entryDate == null) {
            throw new ValidationException("Entry date is required", Map.of("journalEntryId", entryId));
        }
        JournalEntry updated = existing.toBuilder()
            .entryDate(entryDate)
            .description(description)
            .reference(reference)
            .lines(toLines(entryId, existing.getOrganizationId(), lines))
            .build();
        JournalEntry saved = persistenceService.replaceDraft(updated);
        log.info("Updated draft journal entry: journalEntryId={}, lines={}", entryId, saved.getLines().size());
        return saved;
    }

    /**
     * Posts a draft entry.
     *
     * @throws InvalidStateTransitionException if the entry is not a draft
     * @throws com.flagship.revenue_ledger.exception.UnbalancedEntryException if debits differ from credits
     */
    @Transactional
    public JournalEntry postEntry(UUID entryId, String actor) {
        MDC.put("journalEntryId", entryId.toString());
        try {
            requireActor(actor, entryId);
            JournalEntry posted = persistenceService.require(entryId).post(LocalDate.now(clock), actor);
            JournalEntry saved = persistenceService.updateHeader(posted);
            outboxService.saveEvent(LedgerAggregates.JOURNAL_ENTRY, saved.getId(),
                JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.fromEntry(saved));
            metrics.recordJournalEntryPosted("manual");
            log.info("Posted journal entry: number={}, amount={}, postedBy={}",
                saved.getEntryNumber(), saved.totalDebit(), actor);
            return saved;
        } catch (RuntimeException e) {
            log.warn("Posting journal entry failed: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove("journalEntryId");
        }
    }

    /**
     * Marks a posted entry voided. Amounts stay in place.
     */
    @Transactional
    public JournalEntry voidEntry(UUID entryId, String reason, String actor) {
        MDC.put("journalEntryId", entryId.toString());
        try {
            requireActor(actor, entryId);
            JournalEntry voided = persistenceService.require(entryId).voidEntry(LocalDate.now(clock), actor, reason);
            JournalEntry saved = persistenceService.updateHeader(voided);
            outboxService.saveEvent(LedgerAggregates.JOURNAL_ENTRY, saved.getId(),
                JournalEntryVoidedEvent.EVENT_TYPE, JournalEntryVoidedEvent.fromEntry(saved));
            metrics.recordJournalEntryVoided();
            log.info("Voided journal entry: number={}, voidedBy={}, reason={}",
                saved.getEntryNumber(), actor, saved.getVoidReason());
            return saved;
        } finally {
            MDC.remove("journalEntryId");
        }
    }

    @Transactional
    public void deleteEntry(UUID entryId) {
        JournalEntry existing = persistenceService.require(entryId);
        existing.requireDraft("delete");
        persistenceService.delete(entryId);
        log.info("Deleted draft journal entry: journalEntryId={}, number={}", entryId, existing.getEntryNumber());
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(UUID entryId) {
        return persistenceService.require(entryId);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> listEntries(UUID organizationId, JournalEntryStatus status) {
        return persistenceService.findByOrganization(organizationId, status);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String nextEntryNumber(UUID organizationId) {
        return entryNumberSequence.next(organizationId);
    }

    /**
     * Stores an entry that was created already posted (revenue recognition).
     * Runs inside the caller's transaction so the entry commits together with
     * the schedule line it recognizes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JournalEntry recordPostedEntry(JournalEntry entry) {
        if (entry.getStatus() != JournalEntryStatus.POSTED || !entry.isBalanced()) {
            throw new IllegalArgumentException(
                "Only balanced, posted entries can be recorded directly: " + entry.getEntryNumber());
        }
        JournalEntry saved = persistenceService.create(entry);
        outboxService.saveEvent(LedgerAggregates.JOURNAL_ENTRY, saved.getId(),
            JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.fromEntry(saved));
        metrics.recordJournalEntryPosted("recognition");
        return saved;
    }

    private List<JournalLine> toLines(UUID entryId, UUID organizationId, List<JournalLineDraft> drafts) {
        if (drafts == null) {
            return List.of();
        }
        List<JournalLine> lines = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            JournalLineDraft draft = drafts.get(i);
            int lineNumber = i + 1;
            if (draft.getAccountId() == null) {
                throw new ValidationException("Line " + lineNumber + ": account is required",
                    Map.of("journalEntryId", entryId));
            }
            accountService.requireUsableAccount(draft.getAccountId(), organizationId, "Line " + lineNumber + " account");
            BigDecimal debit = Amounts.requireNonNegative(Amounts.orZero(draft.getDebit()), "Line " + lineNumber + " debit");
            BigDecimal credit = Amounts.requireNonNegative(Amounts.orZero(draft.getCredit()), "Line " + lineNumber + " credit");
            if (debit.signum() != 0 && credit.signum() != 0) {
                throw new ValidationException("Line " + lineNumber + " has both a debit and a credit",
                    Map.of("journalEntryId", entryId, "accountId", draft.getAccountId()));
            }
            lines.add(JournalLine.builder()
                .id(UUID.randomUUID())
                .journalEntryId(entryId)
                .lineNumber(lineNumber)
                .accountId(draft.getAccountId())
                .debit(debit)
                .credit(credit)
                .description(draft.getDescription())
                .department(draft.getDepartment())
                .project(draft.getProject())
                .classification(draft.getClassification())
                .location(draft.getLocation())
                .build());
        }
        return lines;
    }

    private void requireActor(String actor, UUID entryId) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("Actor is required", Map.of("journalEntryId", entryId));
        }
    }
}
