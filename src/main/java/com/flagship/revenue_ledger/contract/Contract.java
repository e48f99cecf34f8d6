package com.flagship.revenue_ledger.contract;

import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Domain model for a customer contract and its lines.
 *
 * Immutable: every transition returns a new instance. Lines are kept in
 * {@code sortOrder}.
 */
@Value
@Builder(toBuilder = true)
public class Contract {
    UUID id;
    UUID organizationId;
    String reference;
    BigDecimal totalTransactionPrice;
    String currency;
    LocalDate startDate;
    LocalDate endDate;
    ContractStatus status;
    List<ContractLine> lines;
    Instant createdAt;

    public boolean isDraft() {
        return status == ContractStatus.DRAFT;
    }

    public BigDecimal allocatedTotal() {
        return lines.stream()
            .map(ContractLine::getAllocatedTransactionPrice)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Contract withLines(List<ContractLine> newLines) {
        return toBuilder().lines(List.copyOf(newLines)).build();
    }

    /**
     * Changes header fields; null arguments leave a field as it is. Drafts
     * accept every change. Active contracts only take a new reference or end
     * date, and closed contracts take nothing.
     */
    public Contract updateHeader(String newReference, BigDecimal newTotal, String newCurrency,
                                 LocalDate newStartDate, LocalDate newEndDate) {
        if (status == ContractStatus.COMPLETED || status == ContractStatus.CANCELLED) {
            throw transitionError("update");
        }
        if (status == ContractStatus.ACTIVE && (changes(totalTransactionPrice, newTotal)
                || changes(currency, newCurrency) || changes(startDate, newStartDate))) {
            throw new InvalidStateTransitionException(String.format(
                "Cannot change price, currency or start date of active contract %s", id),
                Map.of("contractId", id));
        }
        return toBuilder()
            .reference(newReference != null ? newReference : reference)
            .totalTransactionPrice(newTotal != null ? newTotal : totalTransactionPrice)
            .currency(newCurrency != null ? newCurrency : currency)
            .startDate(newStartDate != null ? newStartDate : startDate)
            .endDate(newEndDate != null ? newEndDate : endDate)
            .build();
    }

    private static boolean changes(BigDecimal current, BigDecimal requested) {
        return requested != null && requested.compareTo(current) != 0;
    }

    private static boolean changes(Object current, Object requested) {
        return requested != null && !requested.equals(current);
    }

    /**
     * Draft to active; every draft line becomes active with it.
     */
    public Contract activate() {
        requireStatus(ContractStatus.DRAFT, "activate");
        List<ContractLine> activeLines = lines.stream()
            .map(line -> line.getStatus() == ContractLineStatus.DRAFT ? line.withStatus(ContractLineStatus.ACTIVE) : line)
            .toList();
        return toBuilder().status(ContractStatus.ACTIVE).lines(activeLines).build();
    }

    /**
     * Cancels the contract and every line that is not yet closed.
     */
    public Contract cancel() {
        switch (status) {
            case DRAFT, ACTIVE -> {
                List<ContractLine> cancelled = lines.stream()
                    .map(line -> line.getStatus().isClosed() ? line : line.withStatus(ContractLineStatus.CANCELLED))
                    .toList();
                return toBuilder().status(ContractStatus.CANCELLED).lines(cancelled).build();
            }
            case COMPLETED, CANCELLED -> throw transitionError("cancel");
            default -> throw new IllegalStateException("Unknown status: " + status);
        }
    }

    /**
     * Marks one line completed and completes the contract once every line is closed.
     */
    public Contract completeLine(UUID lineId) {
        requireStatus(ContractStatus.ACTIVE, "complete a line of");
        List<ContractLine> updated = lines.stream()
            .map(line -> line.getId().equals(lineId) ? line.withStatus(ContractLineStatus.COMPLETED) : line)
            .toList();
        boolean allClosed = updated.stream().allMatch(line -> line.getStatus().isClosed());
        return toBuilder()
            .lines(updated)
            .status(allClosed ? ContractStatus.COMPLETED : status)
            .build();
    }

    private void requireStatus(ContractStatus expected, String action) {
        if (status != expected) {
            throw transitionError(action);
        }
    }

    private InvalidStateTransitionException transitionError(String action) {
        return new InvalidStateTransitionException(
            String.format("Cannot %s contract %s in %s status", action, id, status),
            Map.of("contractId", id));
    }
}
