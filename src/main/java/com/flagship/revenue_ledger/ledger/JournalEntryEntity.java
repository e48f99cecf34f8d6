package com.flagship.revenue_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for the journal entry header.
 *
 * Key constraints:
 * - (organization_id, entry_number) is unique
 * - revenue_schedule_line_id is unique: one recognition entry per schedule line at most
 * - id, organization, number and source pointers never change after insert
 */
@Entity
@Table(
    name = "journal_entries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_journal_entries_number", columnNames = {"organization_id", "entry_number"}),
        @UniqueConstraint(name = "uq_journal_entries_schedule_line", columnNames = {"revenue_schedule_line_id"})
    },
    indexes = {
        @Index(name = "idx_journal_entries_org_status", columnList = "organization_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "entry_number", nullable = false, updatable = false, length = 32)
    private String entryNumber;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column
    private String description;

    @Column
    private String reference;

    @Column(name = "source_type", updatable = false, length = 50)
    private String sourceType;

    @Column(name = "source_id", updatable = false)
    private UUID sourceId;

    @Column(name = "revenue_schedule_line_id", updatable = false)
    private UUID revenueScheduleLineId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JournalEntryStatus status;

    @Column(name = "posted_at")
    private LocalDate postedAt;

    @Column(name = "posted_by")
    private String postedBy;

    @Column(name = "voided_at")
    private LocalDate voidedAt;

    @Column(name = "voided_by")
    private String voidedBy;

    @Column(name = "void_reason", columnDefinition = "TEXT")
    private String voidReason;

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

    static JournalEntryEntity fromDomain(JournalEntry entry) {
        return new JournalEntryEntity(
            entry.getId(),
            entry.getOrganizationId(),
            entry.getEntryNumber(),
            entry.getEntryDate(),
            entry.getDescription(),
            entry.getReference(),
            entry.getSourceType(),
            entry.getSourceId(),
            entry.getRevenueScheduleLineId(),
            entry.getStatus(),
            entry.getPostedAt(),
            entry.getPostedBy(),
            entry.getVoidedAt(),
            entry.getVoidedBy(),
            entry.getVoidReason(),
            null,
            null
        );
    }

    JournalEntry toDomain(List<JournalLine> lines) {
        return JournalEntry.builder()
            .id(id)
            .organizationId(organizationId)
            .entryNumber(entryNumber)
            .entryDate(entryDate)
            .description(description)
            .reference(reference)
            .sourceType(sourceType)
            .sourceId(sourceId)
            .revenueScheduleLineId(revenueScheduleLineId)
            .status(status)
            .lines(List.copyOf(lines))
            .postedAt(postedAt)
            .postedBy(postedBy)
            .voidedAt(voidedAt)
            .voidedBy(voidedBy)
            .voidReason(voidReason)
            .createdAt(createdAt)
            .build();
    }

    /**
     * Copies header fields that may still move. Edits of date, description and
     * reference are only reachable while the entry is a draft.
     */
    void updateFromDomain(JournalEntry entry) {
        this.entryDate = entry.getEntryDate();
        this.description = entry.getDescription();
        this.reference = entry.getReference();
        this.status = entry.getStatus();
        this.postedAt = entry.getPostedAt();
        this.postedBy = entry.getPostedBy();
        this.voidedAt = entry.getVoidedAt();
        this.voidedBy = entry.getVoidedBy();
        this.voidReason = entry.getVoidReason();
    }
}
