package com.flagship.revenue_ledger.schedule;

import com.flagship.revenue_ledger.contract.ContractStatus;
import com.flagship.revenue_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads and stores revenue schedule aggregates.
 */
@Service
@RequiredArgsConstructor
public class SchedulePersistenceService {

    private final RevenueScheduleRepository scheduleRepository;
    private final RevenueScheduleLineRepository lineRepository;

    /**
     * @throws IllegalStateException if the line amounts do not add up to the schedule total
     */
    @Transactional
    public RevenueSchedule create(RevenueSchedule schedule) {
        if (schedule.lineTotal().compareTo(schedule.getTotalAmount()) != 0) {
            throw new IllegalStateException(String.format("Schedule lines of contract line %s sum to %s, expected %s",
                schedule.getContractLineId(), schedule.lineTotal(), schedule.getTotalAmount()));
        }
        RevenueScheduleEntity saved = scheduleRepository.save(RevenueScheduleEntity.fromDomain(schedule));
        List<RevenueScheduleLine> lines = schedule.getLines().stream()
            .map(line -> lineRepository.save(RevenueScheduleLineEntity.fromDomain(line)).toDomain())
            .toList();
        return saved.toDomain(lines);
    }

    @Transactional(readOnly = true)
    public Optional<RevenueSchedule> findById(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId)
            .map(entity -> entity.toDomain(loadLines(scheduleId)));
    }

    @Transactional(readOnly = true)
    public RevenueSchedule require(UUID scheduleId) {
        return findById(scheduleId)
            .orElseThrow(() -> new NotFoundException("Revenue schedule not found: " + scheduleId,
                Map.of("scheduleId", scheduleId)));
    }

    @Transactional(readOnly = true)
    public Optional<RevenueSchedule> findByContractLineId(UUID contractLineId) {
        return scheduleRepository.findByContractLineId(contractLineId)
            .map(entity -> entity.toDomain(loadLines(entity.getId())));
    }

    /**
     * Schedules of an organization, optionally narrowed to one contract.
     */
    @Transactional(readOnly = true)
    public List<RevenueSchedule> findByOrganization(UUID organizationId, UUID contractId) {
        List<RevenueScheduleEntity> entities = contractId == null
            ? scheduleRepository.findByOrganizationIdOrderByCreatedAtAsc(organizationId)
            : scheduleRepository.findByContract(organizationId, contractId);
        return entities.stream()
            .map(entity -> entity.toDomain(loadLines(entity.getId())))
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean existsForContractLine(UUID contractLineId) {
        return scheduleRepository.existsByContractLineId(contractLineId);
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findContractIdOfLine(UUID scheduleLineId) {
        return lineRepository.findContractIdOfLine(scheduleLineId);
    }

    /**
     * Locks a schedule line for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<RevenueScheduleLine> lockLine(UUID scheduleLineId) {
        return lineRepository.findByIdForUpdate(scheduleLineId).map(RevenueScheduleLineEntity::toDomain);
    }

    /**
     * Writes the schedule status and the mutable state of every line.
     */
    @Transactional
    public RevenueSchedule update(RevenueSchedule schedule) {
        RevenueScheduleEntity entity = scheduleRepository.findById(schedule.getId())
            .orElseThrow(() -> new NotFoundException("Revenue schedule not found: " + schedule.getId(),
                Map.of("scheduleId", schedule.getId())));
        entity.updateFromDomain(schedule);
        scheduleRepository.save(entity);
        for (RevenueScheduleLine line : schedule.getLines()) {
            RevenueScheduleLineEntity lineEntity = lineRepository.findById(line.getId())
                .orElseThrow(() -> new NotFoundException("Schedule line not found: " + line.getId(),
                    Map.of("scheduleLineId", line.getId())));
            lineEntity.updateFromDomain(line);
            lineRepository.save(lineEntity);
        }
        return require(schedule.getId());
    }

    /**
     * Deletes the lines, then the header. Callers check that nothing was posted.
     */
    @Transactional
    public void delete(UUID scheduleId) {
        lineRepository.deleteAll(lineRepository.findByScheduleIdOrderByLineNumberAsc(scheduleId));
        lineRepository.flush();
        scheduleRepository.deleteById(scheduleId);
    }

    @Transactional(readOnly = true)
    public List<DueScheduleLine> findDueLines(UUID organizationId, LocalDate asOf) {
        return lineRepository.findDue(organizationId, asOf, ContractStatus.ACTIVE, ScheduleLineStatus.PLANNED);
    }

    @Transactional(readOnly = true)
    public List<DueScheduleLine> findDueLines(UUID organizationId, UUID contractId, LocalDate asOf) {
        return lineRepository.findDueForContract(organizationId, contractId, asOf,
            ContractStatus.ACTIVE, ScheduleLineStatus.PLANNED);
    }

    /**
     * Non-cancelled lines of an organization dated within {@code [from, to]}.
     */
    @Transactional(readOnly = true)
    public List<RevenueScheduleLine> findActiveLinesInRange(UUID organizationId, LocalDate from, LocalDate to) {
        return lineRepository.findInRangeExcludingStatus(organizationId, from, to, ScheduleLineStatus.CANCELLED)
            .stream()
            .map(RevenueScheduleLineEntity::toDomain)
            .toList();
    }

    private List<RevenueScheduleLine> loadLines(UUID scheduleId) {
        return lineRepository.findByScheduleIdOrderByLineNumberAsc(scheduleId).stream()
            .map(RevenueScheduleLineEntity::toDomain)
            .toList();
    }
}
