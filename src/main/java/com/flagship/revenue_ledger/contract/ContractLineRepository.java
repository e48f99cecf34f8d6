package com.flagship.revenue_ledger.contract;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContractLineRepository extends JpaRepository<ContractLineEntity, UUID> {

    List<ContractLineEntity> findByContractIdOrderBySortOrderAsc(UUID contractId);
}
