package com.flagship.revenue_ledger.schedule;

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

/**
 * JPA entity for one schedule line.
 *
 * Date, period and amount never change after generation. The status moves
 * and the journal entry link is written exactly once.
 */
@Entity
@Table(
    name = "revenue_schedule_lines",
    indexes = {
        @Index(name = "idx_schedule_lines_schedule", columnList = "schedule_id, line_number"),
        @Index(name = "idx_schedule_lines_due", columnList = "status, schedule_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RevenueScheduleLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "schedule_id", nullable = false, updatable = false)
    private UUID scheduleId;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(name = "schedule_date", nullable = false, updatable = false)
    private LocalDate scheduleDate;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private LocalDate periodEnd;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScheduleLineStatus status;

    /**
     * Journal entry that recognized this line. NULL while planned; once set it
     * never changes.
     */
    @Column(name = "journal_entry_id")
    private UUID journalEntryId;

    @Column(name = "posted_at")
    private LocalDate postedAt;

    @Column(name = "posted_by")
    private String postedBy;

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

    static RevenueScheduleLineEntity fromDomain(RevenueScheduleLine line) {
        return new RevenueScheduleLineEntity(
            line.getId(),
            line.getScheduleId(),
            line.getLineNumber(),
            line.getScheduleDate(),
            line.getPeriodStart(),
            line.getPeriodEnd(),
            line.getAmount(),
            line.getStatus(),
            line.getJournalEntryId(),
            line.getPostedAt(),
            line.getPostedBy(),
            null,
            null
        );
    }

    RevenueScheduleLine toDomain() {
        return RevenueScheduleLine.builder()
            .id(id)
            .scheduleId(scheduleId)
            .lineNumber(lineNumber)
            .scheduleDate(scheduleDate)
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .amount(amount)
            .status(status)
            .journalEntryId(journalEntryId)
            .postedAt(postedAt)
            .postedBy(postedBy)
            .build();
    }

    void updateFromDomain(RevenueScheduleLine line) {
        this.status = line.getStatus();
        if (line.getJournalEntryId() != null) {
            setJournalEntryId(line.getJournalEntryId());
        }
        this.postedAt = line.getPostedAt();
        this.postedBy = line.getPostedBy();
    }

    /**
     * Links the posting journal entry. Can be called once; a second, different
     * link means the line would be recognized twice.
     */
    void setJournalEntryId(UUID journalEntryId) {
        if (this.journalEntryId != null && !this.journalEntryId.equals(journalEntryId)) {
            throw new IllegalStateException(
                "Schedule line " + this.id + " is already linked to journal entry " + this.journalEntryId +
                ". Cannot recognize it twice.");
        }
        this.journalEntryId = journalEntryId;
    }
}
