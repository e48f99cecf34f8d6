package com.flagship.revenue_ledger.schedule;

import com.flagship.revenue_ledger.contract.ContractStatus;
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

/**
 * Repository for schedule lines.
 *
 * Provides:
 * - the row lock that serializes concurrent recognition of one line
 * - the due-line selection of a recognition run
 * - the range scan behind the waterfall report
 */
@Repository
public interface RevenueScheduleLineRepository extends JpaRepository<RevenueScheduleLineEntity, UUID> {

    List<RevenueScheduleLineEntity> findByScheduleIdOrderByLineNumberAsc(UUID scheduleId);

    /** Contract owning the schedule line, read without locking. */
    @Query("""
        SELECT cl.contractId FROM RevenueScheduleLineEntity sl, RevenueScheduleEntity s, ContractLineEntity cl
        WHERE sl.id = :id
          AND sl.scheduleId = s.id
          AND s.contractLineId = cl.id
        """)
    Optional<UUID> findContractIdOfLine(@Param("id") UUID id);

    /**
     * Loads a line with {@code SELECT ... FOR UPDATE}. A second transaction
     * asking for the same line waits until the first commits, then sees the
     * committed status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT sl FROM RevenueScheduleLineEntity sl WHERE sl.id = :id")
    Optional<RevenueScheduleLineEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT new com.flagship.revenue_ledger.schedule.DueScheduleLine(
            sl.id, s.id, cl.id, c.id, sl.scheduleDate, sl.amount)
        FROM RevenueScheduleLineEntity sl, RevenueScheduleEntity s,
             ContractLineEntity cl, ContractEntity c
        WHERE sl.scheduleId = s.id
          AND s.contractLineId = cl.id
          AND cl.contractId = c.id
          AND c.organizationId = :organizationId
          AND c.status = :contractStatus
          AND sl.status = :lineStatus
          AND sl.scheduleDate <= :asOf
        ORDER BY sl.scheduleDate ASC, c.id ASC, cl.sortOrder ASC, sl.lineNumber ASC
        """)
    List<DueScheduleLine> findDue(@Param("organizationId") UUID organizationId,
                                  @Param("asOf") LocalDate asOf,
                                  @Param("contractStatus") ContractStatus contractStatus,
                                  @Param("lineStatus") ScheduleLineStatus lineStatus);

    @Query("""
        SELECT new com.flagship.revenue_ledger.schedule.DueScheduleLine(
            sl.id, s.id, cl.id, c.id, sl.scheduleDate, sl.amount)
        FROM RevenueScheduleLineEntity sl, RevenueScheduleEntity s,
             ContractLineEntity cl, ContractEntity c
        WHERE sl.scheduleId = s.id
          AND s.contractLineId = cl.id
          AND cl.contractId = c.id
          AND c.organizationId = :organizationId
          AND c.id = :contractId
          AND c.status = :contractStatus
          AND sl.status = :lineStatus
          AND sl.scheduleDate <= :asOf
        ORDER BY sl.scheduleDate ASC, cl.sortOrder ASC, sl.lineNumber ASC
        """)
    List<DueScheduleLine> findDueForContract(@Param("organizationId") UUID organizationId,
                                             @Param("contractId") UUID contractId,
                                             @Param("asOf") LocalDate asOf,
                                             @Param("contractStatus") ContractStatus contractStatus,
                                             @Param("lineStatus") ScheduleLineStatus lineStatus);

    @Query("""
        SELECT sl FROM RevenueScheduleLineEntity sl, RevenueScheduleEntity s
        WHERE sl.scheduleId = s.id
          AND s.organizationId = :organizationId
          AND sl.status <> :excluded
          AND sl.scheduleDate BETWEEN :fromDate AND :toDate
        ORDER BY sl.scheduleDate ASC
        """)
    List<RevenueScheduleLineEntity> findInRangeExcludingStatus(@Param("organizationId") UUID organizationId,
                                                               @Param("fromDate") LocalDate fromDate,
                                                               @Param("toDate") LocalDate toDate,
                                                               @Param("excluded") ScheduleLineStatus excluded);
}
