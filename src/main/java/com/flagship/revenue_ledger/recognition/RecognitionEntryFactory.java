package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractLine;
import com.flagship.revenue_ledger.ledger.JournalEntry;
import com.flagship.revenue_ledger.ledger.JournalEntryStatus;
import com.flagship.revenue_ledger.ledger.JournalLine;
import com.flagship.revenue_ledger.schedule.RevenueScheduleLine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Builds the journal entry that recognizes one schedule line.
 *
 * Two lines, both for the schedule line amount:
 * 1. debit the deferred-revenue account
 * 2. credit the revenue account
 *
 * The entry goes through {@link JournalEntry#post} so it is born POSTED and
 * passes the same balance check as a manual post.
 */
@Component
public class RecognitionEntryFactory {

    static final String SOURCE_TYPE = "revenue_schedule_line";

    public JournalEntry build(UUID entryId, String entryNumber, Contract contract, ContractLine contractLine,
                              RevenueScheduleLine scheduleLine, LocalDate postingDate, String actor) {
        BigDecimal amount = scheduleLine.getAmount();
        String memo = String.format("Revenue recognition: %s (%s to %s)",
            contractLine.getDescription(), scheduleLine.getPeriodStart(), scheduleLine.getPeriodEnd());

        List<JournalLine> lines = List.of(
            JournalLine.builder()
                .id(UUID.randomUUID())
                .journalEntryId(entryId)
                .lineNumber(1)
                .accountId(contractLine.getDeferredRevenueAccountId())
                .debit(amount)
                .credit(BigDecimal.ZERO.setScale(amount.scale()))
                .description("Release deferred revenue: " + contractLine.getDescription())
                .build(),
            JournalLine.builder()
                .id(UUID.randomUUID())
                .journalEntryId(entryId)
                .lineNumber(2)
                .accountId(contractLine.getRevenueAccountId())
                .debit(BigDecimal.ZERO.setScale(amount.scale()))
                .credit(amount)
                .description("Recognize revenue: " + contractLine.getDescription())
                .build()
        );

        return JournalEntry.builder()
            .id(entryId)
            .organizationId(contract.getOrganizationId())
            .entryNumber(entryNumber)
            .entryDate(postingDate)
            .description(memo)
            .reference(contract.getReference())
            .sourceType(SOURCE_TYPE)
            .sourceId(scheduleLine.getId())
            .revenueScheduleLineId(scheduleLine.getId())
            .status(JournalEntryStatus.DRAFT)
            .lines(lines)
            .build()
            .post(postingDate, actor);
    }
}
