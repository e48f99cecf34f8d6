package com.flagship.revenue_ledger.failure;

import com.flagship.revenue_ledger.LedgerFixtures;
import com.flagship.revenue_ledger.account.AccountService;
import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractService;
import com.flagship.revenue_ledger.ledger.JournalEntry;
import com.flagship.revenue_ledger.ledger.JournalEntryService;
import com.flagship.revenue_ledger.ledger.JournalEntryStatus;
import com.flagship.revenue_ledger.ledger.JournalLineDraft;
import com.flagship.revenue_ledger.outbox.LedgerAggregates;
import com.flagship.revenue_ledger.outbox.OutboxService;
import com.flagship.revenue_ledger.recognition.RecognitionRunResult;
import com.flagship.revenue_ledger.recognition.RecognitionRunService;
import com.flagship.revenue_ledger.schedule.RevenueSchedule;
import com.flagship.revenue_ledger.schedule.ScheduleLineStatus;
import com.flagship.revenue_ledger.schedule.ScheduleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;

/**
 * Failure scenarios: when the outbox write fails, the ledger change it
 * belongs to must not commit.
 *
 * The outbox is replaced by a mock so a failure can be injected at the exact
 * point where the event is written.
 */
@SpringBootTest
@ActiveProfiles("test")
class FailureScenarioTest {

    @MockBean
    private OutboxService outboxService;

    @Autowired
    private RecognitionRunService runService;

    @Autowired
    private JournalEntryService journalEntryService;

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private ContractService contractService;

    @Autowired
    private AccountService accountService;

    private LedgerFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(accountService, contractService);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void failJournalEntryEvents() {
        doThrow(new IllegalStateException("outbox unavailable"))
            .when(outboxService).saveEvent(eq(LedgerAggregates.JOURNAL_ENTRY), any(), anyString(), any());
    }

    @Nested
    @DisplayName("Outbox write fails during recognition")
    class RecognitionOutboxFailure {

        @Test
        @DisplayName("The schedule line stays planned and no entry is left behind")
        void recognitionRolledBack() {
            printTestHeader("Outbox failure during recognition");
            Contract contract = fixtures.activeAnnualSubscription("12000.00");
            failJournalEntryEvents();

            RecognitionRunResult result = runService.runRecognition(fixtures.organizationId,
                LocalDate.of(2024, 1, 31), "system", false);
            System.out.println("OUTPUT - Line results: " + result.getLineResults());

            assertEquals(1, result.getLinesFailed());
            assertNull(result.getLineResults().get(0).getErrorKind());
            assertEquals("Posting failed: IllegalStateException", result.getLineResults().get(0).getMessage());
            assertTrue(journalEntryService.listEntries(fixtures.organizationId, null).isEmpty());

            RevenueSchedule schedule = scheduleService.getScheduleForLine(contract.getLines().get(0).getId());
            assertEquals(ScheduleLineStatus.PLANNED, schedule.getLines().get(0).getStatus());
            assertNull(schedule.getLines().get(0).getJournalEntryId());
        }

        @Test
        @DisplayName("A rolled-back posting releases its entry number")
        void entryNumberReleased() {
            fixtures.activeAnnualSubscription("12000.00");
            failJournalEntryEvents();
            runService.runRecognition(fixtures.organizationId, LocalDate.of(2024, 1, 31), "system", false);

            reset(outboxService);
            RecognitionRunResult retry = runService.runRecognition(fixtures.organizationId,
                LocalDate.of(2024, 1, 31), "system", false);

            assertEquals(1, retry.getLinesPosted());
            JournalEntry entry = journalEntryService.getEntry(retry.getJournalEntryIds().get(0));
            assertEquals("JE-000001", entry.getEntryNumber());
        }
    }

    @Nested
    @DisplayName("Outbox write fails on a manual post")
    class ManualPostOutboxFailure {

        @Test
        @DisplayName("The entry stays a draft")
        void postRolledBack() {
            printTestHeader("Outbox failure on manual post");
            JournalEntry draft = journalEntryService.createDraft(fixtures.organizationId, LocalDate.of(2024, 2, 1),
                "Cash sale", null, "manual", null, List.of(
                    JournalLineDraft.builder().accountId(fixtures.cash.getId()).debit(new BigDecimal("50.00")).build(),
                    JournalLineDraft.builder().accountId(fixtures.revenue.getId()).credit(new BigDecimal("50.00")).build()));
            failJournalEntryEvents();

            assertThrows(IllegalStateException.class, () -> journalEntryService.postEntry(draft.getId(), "alice"));

            JournalEntry reloaded = journalEntryService.getEntry(draft.getId());
            assertEquals(JournalEntryStatus.DRAFT, reloaded.getStatus());
            assertNull(reloaded.getPostedBy());
        }
    }
}
