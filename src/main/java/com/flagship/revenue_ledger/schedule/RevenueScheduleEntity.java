package com.flagship.revenue_ledger.schedule;

import com.flagship.revenue_ledger.contract.RecognitionPattern;
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
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for a revenue schedule header.
 *
 * {@code contract_line_id} is unique: a contract line owns at most one schedule.
 */
@Entity
@Table(
    name = "revenue_schedules",
    indexes = {
        @Index(name = "idx_revenue_schedules_org", columnList = "organization_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RevenueScheduleEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "contract_line_id", nullable = false, updatable = false, unique = true)
    private UUID contractLineId;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "recognition_method", nullable = false, updatable = false, length = 20)
    private RecognitionPattern recognitionMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScheduleStatus status;

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

    static RevenueScheduleEntity fromDomain(RevenueSchedule schedule) {
        return new RevenueScheduleEntity(
            schedule.getId(),
            schedule.getOrganizationId(),
            schedule.getContractLineId(),
            schedule.getTotalAmount(),
            schedule.getRecognitionMethod(),
            schedule.getStatus(),
            null,
            null
        );
    }

    RevenueSchedule toDomain(List<RevenueScheduleLine> lines) {
        return RevenueSchedule.builder()
            .id(id)
            .organizationId(organizationId)
            .contractLineId(contractLineId)
            .totalAmount(totalAmount)
            .recognitionMethod(recognitionMethod)
            .status(status)
            .lines(List.copyOf(lines))
            .createdAt(createdAt)
            .build();
    }

    void updateFromDomain(RevenueSchedule schedule) {
        this.status = schedule.getStatus();
    }
}
