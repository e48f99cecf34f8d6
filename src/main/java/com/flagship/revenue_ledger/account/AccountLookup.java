package com.flagship.revenue_ledger.account;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to accounts for callers that only need to validate references.
 */
public interface AccountLookup {

    Optional<Account> getAccount(UUID accountId);
}
