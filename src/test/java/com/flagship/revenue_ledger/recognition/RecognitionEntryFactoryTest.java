package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractLine;
import com.flagship.revenue_ledger.contract.ContractLineStatus;
import com.flagship.revenue_ledger.contract.ContractStatus;
import com.flagship.revenue_ledger.contract.RecognitionPattern;
import com.flagship.revenue_ledger.ledger.JournalEntry;
import com.flagship.revenue_ledger.ledger.JournalEntryStatus;
import com.flagship.revenue_ledger.ledger.JournalLine;
import com.flagship.revenue_ledger.schedule.RevenueScheduleLine;
import com.flagship.revenue_ledger.schedule.ScheduleLineStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RecognitionEntryFactoryTest {

    private final RecognitionEntryFactory factory = new RecognitionEntryFactory();

    @Test
    @DisplayName("Recognition entry debits deferred revenue and credits revenue, already posted")
    void build_TwoLinePostedEntry() {
        UUID revenueAccount = UUID.randomUUID();
        UUID deferredAccount = UUID.randomUUID();
        UUID contractId = UUID.randomUUID();
        Contract contract = Contract.builder()
            .id(contractId)
            .organizationId(UUID.randomUUID())
            .reference("SO-1001")
            .totalTransactionPrice(new BigDecimal("12000.00"))
            .currency("USD")
            .startDate(LocalDate.of(2024, 1, 1))
            .status(ContractStatus.ACTIVE)
            .lines(List.of())
            .build();
        ContractLine contractLine = ContractLine.builder()
            .id(UUID.randomUUID())
            .contractId(contractId)
            .sortOrder(1)
            .description("Platform subscription")
            .recognitionPattern(RecognitionPattern.STRAIGHT_LINE)
            .allocatedTransactionPrice(new BigDecimal("12000.00"))
            .revenueAccountId(revenueAccount)
            .deferredRevenueAccountId(deferredAccount)
            .status(ContractLineStatus.ACTIVE)
            .build();
        RevenueScheduleLine scheduleLine = RevenueScheduleLine.builder()
            .id(UUID.randomUUID())
            .scheduleId(UUID.randomUUID())
            .lineNumber(1)
            .scheduleDate(LocalDate.of(2024, 1, 31))
            .periodStart(LocalDate.of(2024, 1, 1))
            .periodEnd(LocalDate.of(2024, 1, 31))
            .amount(new BigDecimal("1000.00"))
            .status(ScheduleLineStatus.PLANNED)
            .build();
        UUID entryId = UUID.randomUUID();

        JournalEntry entry = factory.build(entryId, "JE-000007", contract, contractLine, scheduleLine,
            LocalDate.of(2024, 1, 31), "system");

        assertEquals(entryId, entry.getId());
        assertEquals("JE-000007", entry.getEntryNumber());
        assertEquals(JournalEntryStatus.POSTED, entry.getStatus());
        assertEquals(LocalDate.of(2024, 1, 31), entry.getEntryDate());
        assertEquals(scheduleLine.getId(), entry.getRevenueScheduleLineId());
        assertEquals("SO-1001", entry.getReference());
        assertTrue(entry.isBalanced());

        JournalLine debit = entry.getLines().get(0);
        JournalLine credit = entry.getLines().get(1);
        assertEquals(deferredAccount, debit.getAccountId());
        assertEquals(new BigDecimal("1000.00"), debit.getDebit());
        assertEquals(0, debit.getCredit().signum());
        assertEquals(revenueAccount, credit.getAccountId());
        assertEquals(new BigDecimal("1000.00"), credit.getCredit());
        assertEquals(0, credit.getDebit().signum());
    }
}
