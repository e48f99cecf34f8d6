package com.flagship.revenue_ledger.contract;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for the contract header. Lines live in {@link ContractLineEntity}
 * and are loaded separately by contract id.
 *
 * Price, currency and start date can only change while the contract is a
 * draft; {@link Contract#updateHeader} enforces that.
 */
@Entity
@Table(
    name = "contracts",
    indexes = {
        @Index(name = "idx_contracts_org_status", columnList = "organization_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContractEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "reference")
    private String reference;

    @Column(name = "total_transaction_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalTransactionPrice;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ContractStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ContractEntity fromDomain(Contract contract) {
        return new ContractEntity(
            contract.getId(),
            contract.getOrganizationId(),
            contract.getReference(),
            contract.getTotalTransactionPrice(),
            contract.getCurrency(),
            contract.getStartDate(),
            contract.getEndDate(),
            contract.getStatus(),
            null, // set by @PrePersist
            null
        );
    }

    Contract toDomain(List<ContractLine> lines) {
        return Contract.builder()
            .id(id)
            .organizationId(organizationId)
            .reference(reference)
            .totalTransactionPrice(totalTransactionPrice)
            .currency(currency)
            .startDate(startDate)
            .endDate(endDate)
            .status(status)
            .lines(List.copyOf(lines))
            .createdAt(createdAt)
            .build();
    }

    void updateFromDomain(Contract contract) {
        this.reference = contract.getReference();
        this.totalTransactionPrice = contract.getTotalTransactionPrice();
        this.currency = contract.getCurrency();
        this.startDate = contract.getStartDate();
        this.endDate = contract.getEndDate();
        this.status = contract.getStatus();
    }
}
