package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.UnbalancedEntryException;
import com.flagship.revenue_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Journal entry state machine: DRAFT -> POSTED -> VOIDED.
 */
class JournalEntryTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private static JournalLine line(int number, String debit, String credit) {
        return JournalLine.builder()
            .id(UUID.randomUUID())
            .lineNumber(number)
            .accountId(UUID.randomUUID())
            .debit(new BigDecimal(debit))
            .credit(new BigDecimal(credit))
            .build();
    }

    private static JournalEntry draft(JournalLine... lines) {
        return JournalEntry.builder()
            .id(UUID.randomUUID())
            .organizationId(UUID.randomUUID())
            .entryNumber("JE-000001")
            .entryDate(TODAY)
            .status(JournalEntryStatus.DRAFT)
            .lines(List.of(lines))
            .build();
    }

    @Test
    @DisplayName("A balanced draft posts and records who posted it")
    void post_Balanced() {
        JournalEntry posted = draft(line(1, "100.00", "0.00"), line(2, "0.00", "100.00")).post(TODAY, "alice");

        assertEquals(JournalEntryStatus.POSTED, posted.getStatus());
        assertEquals(TODAY, posted.getPostedAt());
        assertEquals("alice", posted.getPostedBy());
    }

    @Test
    @DisplayName("Debits and credits must match to the cent")
    void post_OffByOneCent() {
        JournalEntry entry = draft(line(1, "100.00", "0.00"), line(2, "0.00", "99.99"));

        UnbalancedEntryException e = assertThrows(UnbalancedEntryException.class, () -> entry.post(TODAY, "alice"));
        assertTrue(e.getMessage().contains("100.00"));
        assertEquals(entry.getId(), e.getEntityIds().get("journalEntryId"));
    }

    @Test
    @DisplayName("Equal amounts at different scales still balance")
    void post_ScaleInsensitive() {
        JournalEntry posted = draft(line(1, "50", "0"), line(2, "0", "50.00")).post(TODAY, "alice");

        assertEquals(JournalEntryStatus.POSTED, posted.getStatus());
    }

    @Test
    @DisplayName("An entry without lines cannot be posted")
    void post_NoLines() {
        JournalEntry entry = draft();

        assertThrows(ValidationException.class, () -> entry.post(TODAY, "alice"));
    }

    @Test
    @DisplayName("A posted entry cannot be posted again")
    void post_Twice() {
        JournalEntry posted = draft(line(1, "10.00", "0.00"), line(2, "0.00", "10.00")).post(TODAY, "alice");

        assertThrows(InvalidStateTransitionException.class, () -> posted.post(TODAY, "bob"));
    }

    @Test
    @DisplayName("Voiding keeps the lines and records the reason")
    void void_Posted() {
        JournalEntry posted = draft(line(1, "10.00", "0.00"), line(2, "0.00", "10.00")).post(TODAY, "alice");

        JournalEntry voided = posted.voidEntry(TODAY.plusDays(1), "bob", "  duplicate  ");

        assertEquals(JournalEntryStatus.VOIDED, voided.getStatus());
        assertEquals("duplicate", voided.getVoidReason());
        assertEquals("bob", voided.getVoidedBy());
        assertEquals(2, voided.getLines().size());
        assertTrue(voided.isBalanced());
    }

    @Test
    @DisplayName("Only posted entries can be voided, and only with a reason")
    void void_Rules() {
        JournalEntry draft = draft(line(1, "10.00", "0.00"), line(2, "0.00", "10.00"));
        assertThrows(InvalidStateTransitionException.class, () -> draft.voidEntry(TODAY, "bob", "typo"));

        JournalEntry posted = draft.post(TODAY, "alice");
        assertThrows(ValidationException.class, () -> posted.voidEntry(TODAY, "bob", " "));

        JournalEntry voided = posted.voidEntry(TODAY, "bob", "typo");
        assertThrows(InvalidStateTransitionException.class, () -> voided.voidEntry(TODAY, "bob", "again"));
    }
}
