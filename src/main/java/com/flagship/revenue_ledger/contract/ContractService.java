package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.account.AccountService;
import com.flagship.revenue_ledger.common.Amounts;
import com.flagship.revenue_ledger.contract.event.ContractActivatedEvent;
import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.outbox.LedgerAggregates;
import com.flagship.revenue_ledger.outbox.OutboxService;
import com.flagship.revenue_ledger.schedule.ScheduleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Contract lifecycle: draft assembly, allocation, activation and cancellation.
 *
 * Key principles:
 * - Lines can only be added, changed or removed while the contract is a draft
 * - Allocation writes every line's price in one transaction, or none
 * - Activation allocates, moves contract and lines to ACTIVE and can generate schedules
 * - Cancellation cancels open lines and the planned part of their schedules;
 *   revenue already posted stays in the ledger
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    private final ContractPersistenceService persistenceService;
    private final AllocationEngine allocationEngine;
    private final ScheduleService scheduleService;
    private final AccountService accountService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    @Transactional
    public Contract createContract(UUID organizationId, String reference, BigDecimal totalTransactionPrice,
                                   String currency, LocalDate startDate, LocalDate endDate,
                                   List<ContractLineDraft> lines) {
        if (organizationId == null) {
            throw new ValidationException("Organization is required");
        }
        BigDecimal total = Amounts.requirePositive(totalTransactionPrice, "Total transaction price");
        if (currency == null || !CURRENCY.matcher(currency).matches()) {
            throw new ValidationException("Currency must be a 3-letter ISO code: " + currency);
        }
        if (startDate == null) {
            throw new ValidationException("Contract start date is required");
        }
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("Contract end date " + endDate + " is before start date " + startDate);
        }

        UUID contractId = UUID.randomUUID();
        List<ContractLineDraft> drafts = lines != null ? lines : List.of();
        List<ContractLine> contractLines = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            contractLines.add(toLine(organizationId, contractId, UUID.randomUUID(), i + 1, drafts.get(i)));
        }

        Contract contract = Contract.builder()
            .id(contractId)
            .organizationId(organizationId)
            .reference(reference)
            .totalTransactionPrice(total)
            .currency(currency)
            .startDate(startDate)
            .endDate(endDate)
            .status(ContractStatus.DRAFT)
            .lines(List.copyOf(contractLines))
            .build();

        Contract saved = persistenceService.create(contract);
        log.info("Created contract: contractId={}, total={} {}, lines={}",
            contractId, total, currency, saved.getLines().size());
        return saved;
    }

    @Transactional(readOnly = true)
    public Contract getContract(UUID contractId) {
        return persistenceService.require(contractId);
    }

    @Transactional(readOnly = true)
    public List<Contract> listContracts(UUID organizationId) {
        return persistenceService.findByOrganization(organizationId);
    }

    /**
     * Active contracts of an organization with schedule lines due for recognition.
     */
    @Transactional(readOnly = true)
    public List<Contract> listContractsDueForRecognition(UUID organizationId, LocalDate asOf) {
        if (organizationId == null || asOf == null) {
            throw new ValidationException("Organization and as-of date are required");
        }
        return persistenceService.findContractsDueForRecognition(organizationId, asOf);
    }

    /**
     * Changes header fields of a contract; null arguments are left unchanged.
     *
     * @throws InvalidStateTransitionException if the contract is closed, or active and the
     *         price, currency or start date would change
     */
    @Transactional
    public Contract updateContract(UUID contractId, String reference, BigDecimal totalTransactionPrice,
                                   String currency, LocalDate startDate, LocalDate endDate) {
        MDC.put("contractId", contractId.toString());
        try {
            BigDecimal total = totalTransactionPrice != null
                ? Amounts.requirePositive(totalTransactionPrice, "Total transaction price")
                : null;
            if (currency != null && !CURRENCY.matcher(currency).matches()) {
                throw new ValidationException("Currency must be a 3-letter ISO code: " + currency);
            }
            persistenceService.lock(contractId);
            Contract updated = persistenceService.require(contractId)
                .updateHeader(reference, total, currency, startDate, endDate);
            if (updated.getEndDate() != null && updated.getEndDate().isBefore(updated.getStartDate())) {
                throw new ValidationException("Contract end date " + updated.getEndDate()
                    + " is before start date " + updated.getStartDate(), Map.of("contractId", contractId));
            }
            Contract saved = persistenceService.update(updated);
            log.info("Updated contract header: status={}", saved.getStatus());
            return saved;
        } finally {
            MDC.remove("contractId");
        }
    }

    @Transactional
    public ContractLine addLine(UUID contractId, ContractLineDraft draft) {
        Contract contract = requireDraft(contractId, "add a line to");
        int nextOrder = contract.getLines().stream().mapToInt(ContractLine::getSortOrder).max().orElse(0) + 1;
        ContractLine line = toLine(contract.getOrganizationId(), contractId, UUID.randomUUID(), nextOrder, draft);
        ContractLine saved = persistenceService.saveLine(line);
        log.info("Added line {} to contract {}", saved.getId(), contractId);
        return saved;
    }

    @Transactional
    public ContractLine updateLine(UUID contractLineId, ContractLineDraft draft) {
        ContractLine existing = persistenceService.requireLine(contractLineId);
        Contract contract = requireDraft(existing.getContractId(), "change a line of");
        ContractLine updated = toLine(contract.getOrganizationId(), contract.getId(), existing.getId(),
            existing.getSortOrder(), draft);
        return persistenceService.saveLine(updated);
    }

    @Transactional
    public void removeLine(UUID contractLineId) {
        ContractLine existing = persistenceService.requireLine(contractLineId);
        requireDraft(existing.getContractId(), "remove a line from");
        persistenceService.deleteLine(contractLineId);
        log.info("Removed line {} from contract {}", contractLineId, existing.getContractId());
    }

    @Transactional
    public void deleteContract(UUID contractId) {
        requireDraft(contractId, "delete");
        persistenceService.delete(contractId);
        log.info("Deleted draft contract {}", contractId);
    }

    /**
     * Allocates the contract price across its lines by relative SSP.
     *
     * @throws com.flagship.revenue_ledger.exception.AllocationException if there are no lines
     *         or the total is not positive
     */
    @Transactional
    public AllocationResult allocate(UUID contractId) {
        MDC.put("contractId", contractId.toString());
        try {
            Contract contract = persistenceService.require(contractId);
            if (contract.getStatus() != ContractStatus.DRAFT && contract.getStatus() != ContractStatus.ACTIVE) {
                throw new InvalidStateTransitionException(
                    String.format("Cannot allocate contract %s in %s status", contractId, contract.getStatus()),
                    Map.of("contractId", contractId));
            }
            Contract allocated = persistenceService.update(allocationEngine.allocate(contract));
            metrics.recordAllocation(allocated.getLines().size());
            log.info("Allocated contract: total={}, lines={}",
                allocated.getTotalTransactionPrice(), allocated.getLines().size());
            return toResult(allocated);
        } finally {
            MDC.remove("contractId");
        }
    }

    /**
     * Allocates, activates the contract and its lines, and optionally generates
     * every line's schedule, all in one transaction.
     */
    @Transactional
    public Contract activate(UUID contractId, boolean generateSchedules) {
        MDC.put("contractId", contractId.toString());
        try {
            Contract contract = requireDraft(contractId, "activate");
            Contract activated = persistenceService.update(allocationEngine.allocate(contract).activate());
            metrics.recordAllocation(activated.getLines().size());
            outboxService.saveEvent(LedgerAggregates.CONTRACT, contractId,
                ContractActivatedEvent.EVENT_TYPE, ContractActivatedEvent.fromContract(activated));
            log.info("Activated contract: lines={}", activated.getLines().size());
            if (generateSchedules) {
                scheduleService.generateSchedules(contractId);
            }
            return activated;
        } finally {
            MDC.remove("contractId");
        }
    }

    @Transactional
    public Contract cancel(UUID contractId) {
        MDC.put("contractId", contractId.toString());
        try {
            persistenceService.lock(contractId);
            Contract cancelled = persistenceService.update(persistenceService.require(contractId).cancel());
            scheduleService.cancelSchedules(cancelled);
            log.info("Cancelled contract");
            return cancelled;
        } finally {
            MDC.remove("contractId");
        }
    }

    private Contract requireDraft(UUID contractId, String action) {
        Contract contract = persistenceService.require(contractId);
        if (!contract.isDraft()) {
            throw new InvalidStateTransitionException(
                String.format("Cannot %s contract %s in %s status", action, contractId, contract.getStatus()),
                Map.of("contractId", contractId));
        }
        return contract;
    }

    private ContractLine toLine(UUID organizationId, UUID contractId, UUID lineId, int sortOrder,
                                ContractLineDraft draft) {
        if (draft == null) {
            throw new ValidationException("Contract line is required", Map.of("contractId", contractId));
        }
        if (draft.getDescription() == null || draft.getDescription().isBlank()) {
            throw new ValidationException("Line " + sortOrder + ": description is required",
                Map.of("contractId", contractId));
        }
        if (draft.getRecognitionPattern() == null) {
            throw new ValidationException("Line " + sortOrder + ": recognition pattern is required",
                Map.of("contractId", contractId));
        }
        if (draft.getStartDate() != null && draft.getEndDate() != null
                && draft.getEndDate().isBefore(draft.getStartDate())) {
            throw new ValidationException("Line " + sortOrder + ": end date is before start date",
                Map.of("contractId", contractId));
        }
        BigDecimal quantity = draft.getQuantity() != null ? draft.getQuantity() : BigDecimal.ONE;
        if (quantity.signum() <= 0) {
            throw new ValidationException("Line " + sortOrder + ": quantity must be positive",
                Map.of("contractId", contractId));
        }
        if (draft.getRevenueAccountId() != null) {
            accountService.requireUsableAccount(draft.getRevenueAccountId(), organizationId,
                "Line " + sortOrder + " revenue account");
        }
        if (draft.getDeferredRevenueAccountId() != null) {
            accountService.requireUsableAccount(draft.getDeferredRevenueAccountId(), organizationId,
                "Line " + sortOrder + " deferred revenue account");
        }

        return ContractLine.builder()
            .id(lineId)
            .contractId(contractId)
            .sortOrder(sortOrder)
            .description(draft.getDescription().trim())
            .productType(draft.getProductType())
            .recognitionPattern(draft.getRecognitionPattern())
            .startDate(draft.getStartDate())
            .endDate(draft.getEndDate())
            .quantity(quantity)
            .unitPrice(Amounts.requireNonNegative(Amounts.orZero(draft.getUnitPrice()), "Line " + sortOrder + " unit price"))
            .sspAmount(Amounts.requireNonNegative(Amounts.orZero(draft.getSspAmount()), "Line " + sortOrder + " SSP"))
            .revenueAccountId(draft.getRevenueAccountId())
            .deferredRevenueAccountId(draft.getDeferredRevenueAccountId())
            .status(ContractLineStatus.DRAFT)
            .build();
    }

    private AllocationResult toResult(Contract contract) {
        List<AllocationResult.LineAllocation> allocations = contract.getLines().stream()
            .map(line -> new AllocationResult.LineAllocation(
                line.getId(), line.getSspAmount(), line.getAllocatedTransactionPrice()))
            .toList();
        return new AllocationResult(contract.getId(), contract.getTotalTransactionPrice(), allocations);
    }
}
