package com.flagship.revenue_ledger.contract;

public enum ContractLineStatus {
    DRAFT,
    ACTIVE,
    /** Every schedule line of the line's schedule is posted or cancelled. */
    COMPLETED,
    CANCELLED;

    public boolean isClosed() {
        return switch (this) {
            case COMPLETED, CANCELLED -> true;
            case DRAFT, ACTIVE -> false;
        };
    }
}
