package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.common.MoneyAllocator;
import com.flagship.revenue_ledger.exception.AllocationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Distributes a contract's total transaction price across its lines in
 * proportion to their standalone selling prices.
 *
 * Pure: takes a contract, returns a new contract with every line's allocated
 * price set. Persisting the result is the caller's job.
 *
 * Rules:
 * - Lines are processed in creation order ({@code sortOrder})
 * - Every line but the last gets {@code round(total * ssp / totalSsp)}, half-up to the cent
 * - The last line gets whatever is left, so the allocation sums to the total exactly
 * - If every SSP is zero the price is split evenly, again with the remainder on the last line
 */
@Component
public class AllocationEngine {

    /**
     * @param contract contract with its lines loaded
     * @return the contract with allocated prices on all lines
     * @throws AllocationException if the contract has no lines or a non-positive total
     */
    public Contract allocate(Contract contract) {
        BigDecimal total = contract.getTotalTransactionPrice();
        if (total == null || total.signum() <= 0) {
            throw new AllocationException(
                "Contract total transaction price must be positive to allocate: " + total,
                Map.of("contractId", contract.getId()));
        }
        if (contract.getLines() == null || contract.getLines().isEmpty()) {
            throw new AllocationException(
                "Contract " + contract.getId() + " has no lines to allocate to",
                Map.of("contractId", contract.getId()));
        }

        List<ContractLine> ordered = new ArrayList<>(contract.getLines());
        ordered.sort(Comparator.comparingInt(ContractLine::getSortOrder));

        List<BigDecimal> weights = ordered.stream()
            .map(line -> line.getSspAmount() != null ? line.getSspAmount() : BigDecimal.ZERO)
            .toList();
        List<BigDecimal> shares = MoneyAllocator.allocateByWeights(total, weights);

        List<ContractLine> allocated = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            allocated.add(ordered.get(i).withAllocatedTransactionPrice(shares.get(i)));
        }
        Contract result = contract.withLines(allocated);
        if (result.allocatedTotal().compareTo(total) != 0) {
            throw new IllegalStateException(String.format(
                "Allocation of contract %s sums to %s, expected %s", contract.getId(), result.allocatedTotal(), total));
        }
        return result;
    }
}
