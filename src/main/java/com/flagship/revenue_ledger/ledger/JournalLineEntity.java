package com.flagship.revenue_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * JPA entity for a journal line. Lines are never updated in place: a draft
 * edit deletes and re-inserts the whole set.
 */
@Entity
@Table(
    name = "journal_lines",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_journal_lines_number", columnNames = {"journal_entry_id", "line_number"})
    },
    indexes = {
        @Index(name = "idx_journal_lines_account", columnList = "account_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JournalLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "journal_entry_id", nullable = false, updatable = false)
    private UUID journalEntryId;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal debit;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal credit;

    @Column(updatable = false)
    private String description;

    @Column(updatable = false, length = 100)
    private String department;

    @Column(updatable = false, length = 100)
    private String project;

    @Column(updatable = false, length = 100)
    private String classification;

    @Column(updatable = false, length = 100)
    private String location;

    static JournalLineEntity fromDomain(JournalLine line) {
        return new JournalLineEntity(
            line.getId(),
            line.getJournalEntryId(),
            line.getLineNumber(),
            line.getAccountId(),
            line.getDebit(),
            line.getCredit(),
            line.getDescription(),
            line.getDepartment(),
            line.getProject(),
            line.getClassification(),
            line.getLocation()
        );
    }

    JournalLine toDomain() {
        return JournalLine.builder()
            .id(id)
            .journalEntryId(journalEntryId)
            .lineNumber(lineNumber)
            .accountId(accountId)
            .debit(debit)
            .credit(credit)
            .description(description)
            .department(department)
            .project(project)
            .classification(classification)
            .location(location)
            .build();
    }
}
