package com.flagship.revenue_ledger.account;

import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing the chart of accounts.
 *
 * Uses JDBC directly: accounts are flat rows with no aggregate to map.
 *
 * Rules enforced here:
 * - Account codes are unique per organization (also a database constraint)
 * - System accounts cannot be retyped or deleted
 * - An account referenced by a journal line or a contract line cannot be deleted
 */
@Service
@Slf4j
public class AccountService implements AccountLookup {

    private static final String SELECT_COLUMNS =
        "SELECT id, organization_id, code, name, account_type, active, system_account, created_at FROM accounts";

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public Account createAccount(UUID organizationId, String code, String name,
                                 Account.AccountType type, boolean system) {
        if (organizationId == null) {
            throw new ValidationException("Organization is required");
        }
        if (code == null || code.isBlank()) {
            throw new ValidationException("Account code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (type == null) {
            throw new ValidationException("Account type is required");
        }
        String trimmedCode = code.trim();
        if (codeExists(organizationId, trimmedCode)) {
            throw new ValidationException("Account code already exists: " + trimmedCode,
                Map.of("organizationId", organizationId));
        }

        UUID accountId = UUID.randomUUID();
        try {
            jdbcTemplate.update(
                "INSERT INTO accounts (id, organization_id, code, name, account_type, active, system_account, created_at) " +
                "VALUES (?, ?, ?, ?, ?, TRUE, ?, CURRENT_TIMESTAMP)",
                accountId, organizationId, trimmedCode, name.trim(), type.name(), system
            );
        } catch (DuplicateKeyException e) {
            throw new ValidationException("Account code already exists: " + trimmedCode,
                Map.of("organizationId", organizationId));
        }
        log.info("Created account: accountId={}, code={}, type={}, system={}", accountId, trimmedCode, type, system);
        return requireAccount(accountId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> getAccount(UUID accountId) {
        List<Account> found = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", accountRowMapper(), accountId);
        return found.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Account requireAccount(UUID accountId) {
        return getAccount(accountId)
            .orElseThrow(() -> new NotFoundException("Account not found: " + accountId,
                Map.of("accountId", accountId)));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(UUID organizationId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE organization_id = ? ORDER BY code",
            accountRowMapper(), organizationId);
    }

    /**
     * Updates name, type and active flag. Null arguments leave the field unchanged.
     *
     * @throws InvalidStateTransitionException when retyping a system account
     */
    @Transactional
    public Account updateAccount(UUID accountId, String name, Account.AccountType type, Boolean active) {
        Account existing = requireAccount(accountId);
        if (type != null && type != existing.getType() && existing.isSystem()) {
            throw new InvalidStateTransitionException(
                "System account " + existing.getCode() + " cannot be retyped",
                Map.of("accountId", accountId));
        }
        if (name != null && name.isBlank()) {
            throw new ValidationException("Account name must not be blank", Map.of("accountId", accountId));
        }
        jdbcTemplate.update(
            "UPDATE accounts SET name = ?, account_type = ?, active = ? WHERE id = ?",
            name != null ? name.trim() : existing.getName(),
            (type != null ? type : existing.getType()).name(),
            active != null ? active : existing.isActive(),
            accountId
        );
        log.info("Updated account: accountId={}", accountId);
        return requireAccount(accountId);
    }

    /**
     * Deletes an account that is neither a system account nor referenced anywhere.
     */
    @Transactional
    public void deleteAccount(UUID accountId) {
        Account existing = requireAccount(accountId);
        if (existing.isSystem()) {
            throw new InvalidStateTransitionException(
                "System account " + existing.getCode() + " cannot be deleted",
                Map.of("accountId", accountId));
        }
        Integer journalRefs = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_lines WHERE account_id = ?", Integer.class, accountId);
        Integer contractRefs = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM contract_lines WHERE revenue_account_id = ? OR deferred_revenue_account_id = ?",
            Integer.class, accountId, accountId);
        if ((journalRefs != null && journalRefs > 0) || (contractRefs != null && contractRefs > 0)) {
            throw new InvalidStateTransitionException(
                String.format("Account %s is still referenced by %d journal line(s) and %d contract line(s)",
                    existing.getCode(), journalRefs, contractRefs),
                Map.of("accountId", accountId));
        }
        jdbcTemplate.update("DELETE FROM accounts WHERE id = ?", accountId);
        log.info("Deleted account: accountId={}, code={}", accountId, existing.getCode());
    }

    /**
     * Resolves an account reference supplied as input: it must exist, be active
     * and belong to the given organization.
     *
     * @throws ValidationException if any of these does not hold
     */
    @Transactional(readOnly = true)
    public Account requireUsableAccount(UUID accountId, UUID organizationId, String field) {
        Account account = getAccount(accountId)
            .orElseThrow(() -> new ValidationException(field + " does not exist: " + accountId,
                Map.of("accountId", accountId)));
        if (!account.belongsTo(organizationId)) {
            throw new ValidationException(field + " belongs to another organization: " + accountId,
                Map.of("accountId", accountId, "organizationId", organizationId));
        }
        if (!account.isActive()) {
            throw new ValidationException(field + " is inactive: " + account.getCode(),
                Map.of("accountId", accountId));
        }
        return account;
    }

    private boolean codeExists(UUID organizationId, String code) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE organization_id = ? AND code = ?",
            Integer.class, organizationId, code);
        return count != null && count > 0;
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new Account(
                rs.getObject("id", UUID.class),
                rs.getObject("organization_id", UUID.class),
                rs.getString("code"),
                rs.getString("name"),
                Account.AccountType.valueOf(rs.getString("account_type")),
                rs.getBoolean("active"),
                rs.getBoolean("system_account"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
