package com.flagship.revenue_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a chart-of-accounts entry.
 * Referenced by journal lines and by contract lines (revenue and deferred-revenue assignment).
 */
@Value
public class Account {
    UUID id;
    UUID organizationId;
    String code;
    String name;
    AccountType type;
    boolean active;
    boolean system;
    Instant createdAt;

    public boolean belongsTo(UUID organizationId) {
        return this.organizationId.equals(organizationId);
    }

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY,
        REVENUE,
        EXPENSE
    }
}
