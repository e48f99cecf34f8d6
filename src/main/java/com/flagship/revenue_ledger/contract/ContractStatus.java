package com.flagship.revenue_ledger.contract;

/**
 * Lifecycle of a contract.
 */
public enum ContractStatus {
    /**
     * Contract is being assembled. Lines may be added, changed or removed
     * and the contract may be deleted.
     */
    DRAFT,

    /**
     * Price has been allocated and lines are live. Schedules exist or can be
     * generated and due lines are picked up by recognition runs.
     */
    ACTIVE,

    /**
     * Every line is completed or cancelled. Terminal.
     */
    COMPLETED,

    /**
     * Contract was cancelled. Posted recognition stays in the ledger. Terminal.
     */
    CANCELLED
}
