package com.flagship.revenue_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.revenue_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("organization_id")
    UUID organizationId;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    Account.AccountType accountType;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("system")
    boolean system;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .organizationId(account.getOrganizationId())
            .code(account.getCode())
            .name(account.getName())
            .accountType(account.getType())
            .active(account.isActive())
            .system(account.isSystem())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
