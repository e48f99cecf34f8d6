package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.schedule.ScheduleLineStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContractRepository extends JpaRepository<ContractEntity, UUID> {

    List<ContractEntity> findByOrganizationIdOrderByCreatedAtAsc(UUID organizationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ContractEntity c WHERE c.id = :id")
    Optional<ContractEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Contracts of an organization in the given status that own at least one
     * schedule line in the given status dated on or before {@code asOf}.
     */
    @Query("""
        SELECT DISTINCT c FROM ContractEntity c, ContractLineEntity cl,
            RevenueScheduleEntity s, RevenueScheduleLineEntity sl
        WHERE cl.contractId = c.id
          AND s.contractLineId = cl.id
          AND sl.scheduleId = s.id
          AND c.organizationId = :organizationId
          AND c.status = :contractStatus
          AND sl.status = :lineStatus
          AND sl.scheduleDate <= :asOf
        """)
    List<ContractEntity> findWithScheduleLinesDue(@Param("organizationId") UUID organizationId,
                                                  @Param("asOf") LocalDate asOf,
                                                  @Param("contractStatus") ContractStatus contractStatus,
                                                  @Param("lineStatus") ScheduleLineStatus lineStatus);
}
