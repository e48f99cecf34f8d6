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
import java.util.UUID;

@Entity
@Table(
    name = "contract_lines",
    indexes = {
        @Index(name = "idx_contract_lines_contract", columnList = "contract_id, sort_order")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContractLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Column(name = "sort_order", nullable = false, updatable = false)
    private int sortOrder;

    @Column(nullable = false)
    private String description;

    @Column(name = "product_type")
    private String productType;

    @Enumerated(EnumType.STRING)
    @Column(name = "recognition_pattern", nullable = false, length = 20)
    private RecognitionPattern recognitionPattern;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "ssp_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal sspAmount;

    @Column(name = "allocated_transaction_price", precision = 19, scale = 2)
    private BigDecimal allocatedTransactionPrice;

    @Column(name = "revenue_account_id")
    private UUID revenueAccountId;

    @Column(name = "deferred_revenue_account_id")
    private UUID deferredRevenueAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ContractLineStatus status;

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

    static ContractLineEntity fromDomain(ContractLine line) {
        return new ContractLineEntity(
            line.getId(),
            line.getContractId(),
            line.getSortOrder(),
            line.getDescription(),
            line.getProductType(),
            line.getRecognitionPattern(),
            line.getStartDate(),
            line.getEndDate(),
            line.getQuantity(),
            line.getUnitPrice(),
            line.getSspAmount(),
            line.getAllocatedTransactionPrice(),
            line.getRevenueAccountId(),
            line.getDeferredRevenueAccountId(),
            line.getStatus(),
            null,
            null
        );
    }

    ContractLine toDomain() {
        return ContractLine.builder()
            .id(id)
            .contractId(contractId)
            .sortOrder(sortOrder)
            .description(description)
            .productType(productType)
            .recognitionPattern(recognitionPattern)
            .startDate(startDate)
            .endDate(endDate)
            .quantity(quantity)
            .unitPrice(unitPrice)
            .sspAmount(sspAmount)
            .allocatedTransactionPrice(allocatedTransactionPrice)
            .revenueAccountId(revenueAccountId)
            .deferredRevenueAccountId(deferredRevenueAccountId)
            .status(status)
            .build();
    }

    /**
     * Copies every field except identity, owner and ordering.
     * Whether the change is allowed is decided by the service before calling this.
     */
    void updateFromDomain(ContractLine line) {
        this.description = line.getDescription();
        this.productType = line.getProductType();
        this.recognitionPattern = line.getRecognitionPattern();
        this.startDate = line.getStartDate();
        this.endDate = line.getEndDate();
        this.quantity = line.getQuantity();
        this.unitPrice = line.getUnitPrice();
        this.sspAmount = line.getSspAmount();
        this.allocatedTransactionPrice = line.getAllocatedTransactionPrice();
        this.revenueAccountId = line.getRevenueAccountId();
        this.deferredRevenueAccountId = line.getDeferredRevenueAccountId();
        this.status = line.getStatus();
    }
}
