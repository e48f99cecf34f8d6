package com.flagship.revenue_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.ledger.JournalEntry;
import com.flagship.revenue_ledger.ledger.JournalEntryStatus;
import com.flagship.revenue_ledger.ledger.JournalLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("organization_id")
    UUID organizationId;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("source_type")
    String sourceType;

    @JsonProperty("source_id")
    UUID sourceId;

    @JsonProperty("revenue_schedule_line_id")
    UUID revenueScheduleLineId;

    @JsonProperty("status")
    JournalEntryStatus status;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("posted_at")
    LocalDate postedAt;

    @JsonProperty("posted_by")
    String postedBy;

    @JsonProperty("voided_at")
    LocalDate voidedAt;

    @JsonProperty("voided_by")
    String voidedBy;

    @JsonProperty("void_reason")
    String voidReason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .organizationId(entry.getOrganizationId())
            .entryNumber(entry.getEntryNumber())
            .entryDate(entry.getEntryDate())
            .description(entry.getDescription())
            .reference(entry.getReference())
            .sourceType(entry.getSourceType())
            .sourceId(entry.getSourceId())
            .revenueScheduleLineId(entry.getRevenueScheduleLineId())
            .status(entry.getStatus())
            .totalDebit(entry.totalDebit())
            .totalCredit(entry.totalCredit())
            .lines(entry.getLines().stream().map(Line::from).toList())
            .postedAt(entry.getPostedAt())
            .postedBy(entry.getPostedBy())
            .voidedAt(entry.getVoidedAt())
            .voidedBy(entry.getVoidedBy())
            .voidReason(entry.getVoidReason())
            .createdAt(entry.getCreatedAt())
            .build();
    }

    @Value
    @Builder
    public static class Line {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("description")
        String description;

        @JsonProperty("department")
        String department;

        @JsonProperty("project")
        String project;

        @JsonProperty("classification")
        String classification;

        @JsonProperty("location")
        String location;

        static Line from(JournalLine line) {
            return Line.builder()
                .id(line.getId())
                .lineNumber(line.getLineNumber())
                .accountId(line.getAccountId())
                .debit(line.getDebit())
                .credit(line.getCredit())
                .description(line.getDescription())
                .department(line.getDepartment())
                .project(line.getProject())
                .classification(line.getClassification())
                .location(line.getLocation())
                .build();
        }
    }
}
