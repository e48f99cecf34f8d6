package com.flagship.revenue_ledger.recognition;

import com.flagship.revenue_ledger.account.Account;
import com.flagship.revenue_ledger.account.AccountLookup;
import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractLine;
import com.flagship.revenue_ledger.contract.ContractPersistenceService;
import com.flagship.revenue_ledger.contract.ContractStatus;
import com.flagship.revenue_ledger.exception.ConfigurationException;
import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.JournalEntry;
import com.flagship.revenue_ledger.ledger.JournalEntryService;
import com.flagship.revenue_ledger.schedule.RevenueSchedule;
import com.flagship.revenue_ledger.schedule.RevenueScheduleLine;
import com.flagship.revenue_ledger.schedule.ScheduleLineStatus;
import com.flagship.revenue_ledger.schedule.SchedulePersistenceService;
import com.flagship.revenue_ledger.schedule.ScheduleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Posts one schedule line to the ledger.
 *
 * Every call runs in its own transaction, which commits or rolls back
 * independently of any batch that called it. Inside that transaction:
 * 1. The contract row, then the schedule line row, are locked (SELECT ... FOR UPDATE)
 * 2. A line that is already posted returns its existing entry (idempotent)
 * 3. Both recognition accounts must be assigned, active and in the organization
 * 4. A posted, balanced journal entry is created (debit deferred, credit revenue)
 * 5. The line is marked posted and linked to the entry
 * 6. Schedule status is re-derived; a completed schedule completes its
 *    contract line, and the last completed line completes the contract
 *
 * The locks plus the unique journal_entries.revenue_schedule_line_id column
 * guarantee at most one journal entry per schedule line, also across
 * concurrent runs. The contract lock serializes postings of one contract, so
 * schedule and contract completion are derived from committed line states.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecognitionPostingService {

    private final SchedulePersistenceService schedulePersistenceService;
    private final ContractPersistenceService contractPersistenceService;
    private final JournalEntryService journalEntryService;
    private final RecognitionEntryFactory entryFactory;
    private final AccountLookup accountLookup;

    /**
     * @param postingDate date stamped on the entry; null means the line's schedule date
     * @throws ConfigurationException if a recognition account is missing or unusable; the line stays planned
     * @throws InvalidStateTransitionException if the line is cancelled or the contract is not active
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RecognitionPostingResult postScheduleLine(UUID scheduleLineId, LocalDate postingDate, String actor) {
        MDC.put("scheduleLineId", scheduleLineId.toString());
        try {
            if (actor == null || actor.isBlank()) {
                throw new ValidationException("Actor is required", Map.of("scheduleLineId", scheduleLineId));
            }
            UUID contractId = schedulePersistenceService.findContractIdOfLine(scheduleLineId)
                .orElseThrow(() -> new NotFoundException("Schedule line not found: " + scheduleLineId,
                    Map.of("scheduleLineId", scheduleLineId)));
            contractPersistenceService.lock(contractId);
            RevenueScheduleLine line = schedulePersistenceService.lockLine(scheduleLineId)
                .orElseThrow(() -> new NotFoundException("Schedule line not found: " + scheduleLineId,
                    Map.of("scheduleLineId", scheduleLineId)));

            if (line.getStatus() == ScheduleLineStatus.POSTED) {
                log.info("Schedule line already posted: journalEntryId={}", line.getJournalEntryId());
                return new RecognitionPostingResult(line.getId(), RecognitionPostingResult.Outcome.ALREADY_POSTED,
                    line.getJournalEntryId(), null, line.getAmount(), line.getPostedAt());
            }
            if (line.getStatus() == ScheduleLineStatus.CANCELLED) {
                throw new InvalidStateTransitionException(
                    "Schedule line " + scheduleLineId + " is cancelled and cannot be posted",
                    Map.of("scheduleLineId", scheduleLineId));
            }

            RevenueSchedule schedule = schedulePersistenceService.require(line.getScheduleId());
            ContractLine contractLine = contractPersistenceService.requireLine(schedule.getContractLineId());
            Contract contract = contractPersistenceService.require(contractId);
            if (contract.getStatus() != ContractStatus.ACTIVE) {
                throw new InvalidStateTransitionException(
                    String.format("Cannot recognize revenue for contract %s in %s status",
                        contract.getId(), contract.getStatus()),
                    Map.of("contractId", contract.getId(), "scheduleLineId", scheduleLineId));
            }
            requireRecognitionAccounts(contract, contractLine, line);

            LocalDate postedOn = postingDate != null ? postingDate : line.getScheduleDate();
            JournalEntry entry = journalEntryService.recordPostedEntry(entryFactory.build(
                UUID.randomUUID(),
                journalEntryService.nextEntryNumber(contract.getOrganizationId()),
                contract, contractLine, line, postedOn, actor));

            RevenueSchedule updated = schedulePersistenceService.update(
                schedule.withLine(line.markPosted(entry.getId(), postedOn, actor)));
            if (updated.getStatus() == ScheduleStatus.COMPLETED) {
                Contract afterLine = contractPersistenceService.update(contract.completeLine(contractLine.getId()));
                log.info("Schedule {} completed; contract line {} completed, contract now {}",
                    updated.getId(), contractLine.getId(), afterLine.getStatus());
            }

            log.info("Recognized revenue: journalEntry={}, amount={}, date={}",
                entry.getEntryNumber(), line.getAmount(), postedOn);
            return new RecognitionPostingResult(line.getId(), RecognitionPostingResult.Outcome.POSTED,
                entry.getId(), entry.getEntryNumber(), line.getAmount(), postedOn);
        } finally {
            MDC.remove("scheduleLineId");
        }
    }

    private void requireRecognitionAccounts(Contract contract, ContractLine contractLine, RevenueScheduleLine line) {
        Map<String, Object> ids = new LinkedHashMap<>();
        ids.put("scheduleLineId", line.getId());
        ids.put("contractLineId", contractLine.getId());
        ids.put("contractId", contract.getId());

        if (contractLine.getRevenueAccountId() == null) {
            throw new ConfigurationException(
                "Contract line " + contractLine.getId() + " has no revenue account", ids);
        }
        if (contractLine.getDeferredRevenueAccountId() == null) {
            throw new ConfigurationException(
                "Contract line " + contractLine.getId() + " has no deferred revenue account", ids);
        }
        requireUsable(contractLine.getRevenueAccountId(), "Revenue", contract, ids);
        requireUsable(contractLine.getDeferredRevenueAccountId(), "Deferred revenue", contract, ids);
    }

    private void requireUsable(UUID accountId, String role, Contract contract, Map<String, Object> ids) {
        Map<String, Object> withAccount = new LinkedHashMap<>(ids);
        withAccount.put("accountId", accountId);
        Account account = accountLookup.getAccount(accountId)
            .orElseThrow(() -> new ConfigurationException(role + " account " + accountId + " does not exist", withAccount));
        if (!account.belongsTo(contract.getOrganizationId())) {
            throw new ConfigurationException(role + " account " + account.getCode() + " belongs to another organization",
                withAccount);
        }
        if (!account.isActive()) {
            throw new ConfigurationException(role + " account " + account.getCode() + " is inactive", withAccount);
        }
    }
}
