package com.flagship.revenue_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.account.Account;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Partial update; null fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateAccountRequest {

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    Account.AccountType accountType;

    @JsonProperty("active")
    Boolean active;
}
