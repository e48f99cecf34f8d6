package com.flagship.revenue_ledger.contract.event;

import com.flagship.revenue_ledger.contract.Contract;
import com.flagship.revenue_ledger.ledger.event.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a contract goes live with its allocated prices.
 */
@Value
public class ContractActivatedEvent implements LedgerEvent {
    UUID eventId;
    UUID organizationId;
    UUID contractId;
    BigDecimal totalTransactionPrice;
    String currency;
    List<LineAllocation> allocations;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractActivated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContractActivatedEvent fromContract(Contract contract) {
        List<LineAllocation> allocations = contract.getLines().stream()
            .map(line -> new LineAllocation(line.getId(), line.getAllocatedTransactionPrice()))
            .toList();
        return new ContractActivatedEvent(
            UUID.randomUUID(),
            contract.getOrganizationId(),
            contract.getId(),
            contract.getTotalTransactionPrice(),
            contract.getCurrency(),
            allocations,
            Instant.now()
        );
    }

    @Value
    public static class LineAllocation {
        UUID contractLineId;
        BigDecimal allocatedTransactionPrice;
    }
}
