package com.flagship.revenue_ledger.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RevenueScheduleRepository extends JpaRepository<RevenueScheduleEntity, UUID> {

    Optional<RevenueScheduleEntity> findByContractLineId(UUID contractLineId);

    boolean existsByContractLineId(UUID contractLineId);

    List<RevenueScheduleEntity> findByOrganizationIdOrderByCreatedAtAsc(UUID organizationId);

    @Query("""
        SELECT s FROM RevenueScheduleEntity s, ContractLineEntity cl
        WHERE s.contractLineId = cl.id
          AND s.organizationId = :organizationId
          AND cl.contractId = :contractId
        ORDER BY cl.sortOrder ASC
        """)
    List<RevenueScheduleEntity> findByContract(@Param("organizationId") UUID organizationId,
                                               @Param("contractId") UUID contractId);
}
