package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.schedule.ScheduleLineStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads and stores contract aggregates (header plus lines).
 *
 * Conversion between domain objects and entities happens only here; callers
 * work with {@link Contract} and {@link ContractLine}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractPersistenceService {

    private final ContractRepository contractRepository;
    private final ContractLineRepository lineRepository;

    @Transactional
    public Contract create(Contract contract) {
        ContractEntity saved = contractRepository.save(ContractEntity.fromDomain(contract));
        List<ContractLine> lines = contract.getLines().stream()
            .map(line -> lineRepository.save(ContractLineEntity.fromDomain(line)).toDomain())
            .toList();
        log.debug("Persisted contract: contractId={}, lines={}", saved.getId(), lines.size());
        return saved.toDomain(lines);
    }

    @Transactional(readOnly = true)
    public Optional<Contract> findById(UUID contractId) {
        return contractRepository.findById(contractId)
            .map(entity -> entity.toDomain(loadLines(contractId)));
    }

    @Transactional(readOnly = true)
    public Contract require(UUID contractId) {
        return findById(contractId)
            .orElseThrow(() -> new NotFoundException("Contract not found: " + contractId,
                Map.of("contractId", contractId)));
    }

    /**
     * Active contracts with planned schedule lines due on or before {@code asOf}.
     */
    @Transactional(readOnly = true)
    public List<Contract> findContractsDueForRecognition(UUID organizationId, LocalDate asOf) {
        return contractRepository.findWithScheduleLinesDue(organizationId, asOf,
                ContractStatus.ACTIVE, ScheduleLineStatus.PLANNED).stream()
            .sorted(Comparator.comparing(ContractEntity::getCreatedAt))
            .map(entity -> entity.toDomain(loadLines(entity.getId())))
            .toList();
    }

    /**
     * Locks the contract header row until the caller's transaction ends.
     * Recognition postings and cancellation of one contract take this lock
     * first, so they never work on a stale view of its schedules.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lock(UUID contractId) {
        contractRepository.findByIdForUpdate(contractId)
            .orElseThrow(() -> new NotFoundException("Contract not found: " + contractId,
                Map.of("contractId", contractId)));
    }

    @Transactional(readOnly = true)
    public ContractLine requireLine(UUID contractLineId) {
        return lineRepository.findById(contractLineId)
            .map(ContractLineEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Contract line not found: " + contractLineId,
                Map.of("contractLineId", contractLineId)));
    }

    @Transactional(readOnly = true)
    public List<Contract> findByOrganization(UUID organizationId) {
        return contractRepository.findByOrganizationIdOrderByCreatedAtAsc(organizationId).stream()
            .map(entity -> entity.toDomain(loadLines(entity.getId())))
            .toList();
    }

    /**
     * Writes the header status and every line of the aggregate. Lines unknown
     * to the database are inserted.
     */
    @Transactional
    public Contract update(Contract contract) {
        ContractEntity entity = contractRepository.findById(contract.getId())
            .orElseThrow(() -> new NotFoundException("Contract not found: " + contract.getId(),
                Map.of("contractId", contract.getId())));
        entity.updateFromDomain(contract);
        contractRepository.save(entity);
        contract.getLines().forEach(this::saveLine);
        return require(contract.getId());
    }

    @Transactional
    public ContractLine saveLine(ContractLine line) {
        ContractLineEntity entity = lineRepository.findById(line.getId())
            .map(existing -> {
                existing.updateFromDomain(line);
                return existing;
            })
            .orElseGet(() -> ContractLineEntity.fromDomain(line));
        return lineRepository.save(entity).toDomain();
    }

    @Transactional
    public void deleteLine(UUID contractLineId) {
        lineRepository.deleteById(contractLineId);
    }

    /**
     * Deletes the lines first, then the header. Callers check the status.
     */
    @Transactional
    public void delete(UUID contractId) {
        List<ContractLineEntity> lines = lineRepository.findByContractIdOrderBySortOrderAsc(contractId);
        lineRepository.deleteAll(lines);
        lineRepository.flush();
        contractRepository.deleteById(contractId);
    }

    private List<ContractLine> loadLines(UUID contractId) {
        return lineRepository.findByContractIdOrderBySortOrderAsc(contractId).stream()
            .map(ContractLineEntity::toDomain)
            .toList();
    }
}
