package com.flagship.revenue_ledger.schedule;

import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.contract.ContractLine;
import com.flagship.revenue_ledger.contract.ContractLineStatus;
import com.flagship.revenue_ledger.contract.ContractPersistenceService;
import com.flagship.revenue_ledger.contract.ContractStatus;
import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates, cancels and removes revenue schedules.
 *
 * A contract line owns at most one schedule. Generating twice is a no-op that
 * returns empty; the unique constraint on {@code contract_line_id} backs this
 * up in the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private final ScheduleGenerator scheduleGenerator;
    private final SchedulePersistenceService persistenceService;
    private final ContractPersistenceService contractPersistenceService;

    /**
     * Generates the schedule of one contract line.
     *
     * @return the new schedule, or empty if the line already has one
     * @throws InvalidStateTransitionException if the contract or line is not active
     */
    @Transactional
    public Optional<RevenueSchedule> generateSchedule(UUID contractLineId) {
        MDC.put("contractLineId", contractLineId.toString());
        try {
            ContractLine line = contractPersistenceService.requireLine(contractLineId);
            Contract contract = contractPersistenceService.require(line.getContractId());
            return generateFor(contract, line);
        } finally {
            MDC.remove("contractLineId");
        }
    }

    /**
     * Generates schedules for every line of a contract that does not have one yet.
     *
     * @return the schedules created by this call
     */
    @Transactional
    public List<RevenueSchedule> generateSchedules(UUID contractId) {
        Contract contract = contractPersistenceService.require(contractId);
        List<RevenueSchedule> created = new ArrayList<>();
        for (ContractLine line : contract.getLines()) {
            if (line.getStatus() == ContractLineStatus.ACTIVE) {
                generateFor(contract, line).ifPresent(created::add);
            }
        }
        log.info("Generated {} schedule(s) for contract {}", created.size(), contractId);
        return created;
    }

    @Transactional(readOnly = true)
    public RevenueSchedule getScheduleForLine(UUID contractLineId) {
        return persistenceService.findByContractLineId(contractLineId)
            .orElseThrow(() -> new NotFoundException("No revenue schedule for contract line " + contractLineId,
                Map.of("contractLineId", contractLineId)));
    }

    @Transactional(readOnly = true)
    public RevenueSchedule getSchedule(UUID scheduleId) {
        return persistenceService.require(scheduleId);
    }

    /**
     * Schedules of an organization. {@code contractId} and {@code status} are
     * optional filters.
     */
    @Transactional(readOnly = true)
    public List<RevenueSchedule> listSchedules(UUID organizationId, UUID contractId, ScheduleStatus status) {
        if (organizationId == null) {
            throw new ValidationException("Organization is required");
        }
        return persistenceService.findByOrganization(organizationId, contractId).stream()
            .filter(schedule -> status == null || schedule.getStatus() == status)
            .toList();
    }

    /**
     * Cancels the schedules of a contract's lines. Planned lines are cancelled,
     * posted lines stay as they are. Completed schedules keep their status.
     */
    @Transactional
    public void cancelSchedules(Contract contract) {
        for (ContractLine line : contract.getLines()) {
            persistenceService.findByContractLineId(line.getId())
                .filter(RevenueSchedule::hasPlannedLines)
                .ifPresent(schedule -> {
                    persistenceService.update(schedule.cancel());
                    log.info("Cancelled schedule {} of contract line {}", schedule.getId(), line.getId());
                });
        }
    }

    /**
     * Removes a schedule so it can be generated again.
     *
     * @throws InvalidStateTransitionException if any line of the schedule is posted
     */
    @Transactional
    public void deleteSchedule(UUID scheduleId) {
        RevenueSchedule schedule = persistenceService.require(scheduleId);
        if (schedule.hasPostedLines()) {
            throw new InvalidStateTransitionException(
                "Schedule " + scheduleId + " has posted lines and cannot be deleted",
                Map.of("scheduleId", scheduleId, "contractLineId", schedule.getContractLineId()));
        }
        persistenceService.delete(scheduleId);
        log.info("Deleted schedule {} of contract line {}", scheduleId, schedule.getContractLineId());
    }

    private Optional<RevenueSchedule> generateFor(Contract contract, ContractLine line) {
        if (contract.getStatus() != ContractStatus.ACTIVE || line.getStatus() != ContractLineStatus.ACTIVE) {
            throw new InvalidStateTransitionException(
                String.format("Cannot generate a schedule for line %s: contract is %s, line is %s",
                    line.getId(), contract.getStatus(), line.getStatus()),
                Map.of("contractId", contract.getId(), "contractLineId", line.getId()));
        }
        if (persistenceService.existsForContractLine(line.getId())) {
            log.debug("Schedule already exists for contract line {}", line.getId());
            return Optional.empty();
        }

        RevenueSchedule schedule = persistenceService.create(scheduleGenerator.generate(contract, line));
        log.info("Generated schedule: scheduleId={}, contractLineId={}, method={}, lines={}, total={}",
            schedule.getId(), line.getId(), schedule.getRecognitionMethod(),
            schedule.getLines().size(), schedule.getTotalAmount());
        return Optional.of(schedule);
    }
}
