package com.flagship.revenue_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.account.Account;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotNull(message = "Organization ID is required")
    @JsonProperty("organization_id")
    UUID organizationId;

    @NotBlank(message = "Account code is required")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Account name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    Account.AccountType accountType;

    @JsonProperty("system")
    boolean system;
}
