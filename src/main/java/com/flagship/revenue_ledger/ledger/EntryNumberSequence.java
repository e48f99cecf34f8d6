package com.flagship.revenue_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Hands out journal entry numbers per organization: JE-000001, JE-000002, ...
 *
 * The counter lives in {@code journal_entry_sequences} and is bumped with an
 * UPDATE, which row-locks it until the caller's transaction ends. Concurrent
 * entries of one organization therefore get distinct numbers, and a number
 * whose entry is later deleted is never handed out again. A rolled-back
 * transaction releases its number, so numbers are unique but not gap-free.
 */
@Component
@Slf4j
public class EntryNumberSequence {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate separateTransaction;

    @Value("${revenue-ledger.journal.entry-number-prefix:JE-}")
    private String prefix;

    @Value("${revenue-ledger.journal.entry-number-width:6}")
    private int width;

    public EntryNumberSequence(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.separateTransaction = new TransactionTemplate(transactionManager);
        this.separateTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public String next(UUID organizationId) {
        if (increment(organizationId) == 0) {
            createCounter(organizationId);
            if (increment(organizationId) == 0) {
                throw new IllegalStateException("Entry number counter missing for organization " + organizationId);
            }
        }
        Long value = jdbcTemplate.queryForObject(
            "SELECT last_number FROM journal_entry_sequences WHERE organization_id = ?", Long.class, organizationId);
        return format(value);
    }

    String format(long value) {
        return prefix + String.format("%0" + width + "d", value);
    }

    private int increment(UUID organizationId) {
        return jdbcTemplate.update(
            "UPDATE journal_entry_sequences SET last_number = last_number + 1 WHERE organization_id = ?",
            organizationId);
    }

    /**
     * Creates the counter row in its own transaction so a lost insert race
     * does not poison the caller's transaction.
     */
    private void createCounter(UUID organizationId) {
        try {
            separateTransaction.executeWithoutResult(status -> jdbcTemplate.update(
                "INSERT INTO journal_entry_sequences (organization_id, last_number) VALUES (?, 0)",
                organizationId));
            log.info("Started journal entry numbering for organization {}", organizationId);
        } catch (DuplicateKeyException e) {
            log.debug("Entry number counter for organization {} was created concurrently", organizationId);
        }
    }
}
