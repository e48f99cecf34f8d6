package com.flagship.revenue_ledger.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.account.dto.CreateAccountRequest;
import com.flagship.revenue_ledger.account.dto.UpdateAccountRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AccountControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID organizationId;

    @BeforeEach
    void setUp() {
        organizationId = UUID.randomUUID();
    }

    private CreateAccountRequest account(String code, String name, Account.AccountType type, boolean system) {
        return CreateAccountRequest.builder()
            .organizationId(organizationId)
            .code(code)
            .name(name)
            .accountType(type)
            .system(system)
            .build();
    }

    private UUID create(CreateAccountRequest request) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }

    @Test
    @DisplayName("Created accounts are listed by code")
    void createAndList() throws Exception {
        UUID revenueId = create(account("4000", "Revenue", Account.AccountType.REVENUE, false));
        create(account("2400", "Deferred revenue", Account.AccountType.LIABILITY, false));

        mockMvc.perform(get("/api/accounts/{id}", revenueId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value("4000"))
            .andExpect(jsonPath("$.account_type").value("REVENUE"))
            .andExpect(jsonPath("$.active").value(true));

        mockMvc.perform(get("/api/accounts").param("organization_id", organizationId.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].code").value("2400"))
            .andExpect(jsonPath("$[1].code").value("4000"));
    }

    @Test
    @DisplayName("Duplicate code in one organization is rejected")
    void duplicateCode() throws Exception {
        create(account("1000", "Cash", Account.AccountType.ASSET, false));

        mockMvc.perform(post("/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(account("1000", "Cash again", Account.AccountType.ASSET, false))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION"));
    }

    @Test
    @DisplayName("Missing name fails bean validation")
    void missingName() throws Exception {
        mockMvc.perform(post("/api/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(account("1000", null, Account.AccountType.ASSET, false))))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Deactivate through PATCH")
    void deactivate() throws Exception {
        UUID id = create(account("1000", "Cash", Account.AccountType.ASSET, false));
        UpdateAccountRequest update = UpdateAccountRequest.builder().active(false).build();

        mockMvc.perform(patch("/api/accounts/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(update)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.active").value(false))
            .andExpect(jsonPath("$.name").value("Cash"));
    }

    @Test
    @DisplayName("System accounts cannot be deleted or retyped")
    void systemAccountGuards() throws Exception {
        UUID id = create(account("2400", "Deferred revenue", Account.AccountType.LIABILITY, true));

        mockMvc.perform(delete("/api/accounts/{id}", id))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INVALID_STATE_TRANSITION"));

        UpdateAccountRequest retype = UpdateAccountRequest.builder().accountType(Account.AccountType.ASSET).build();
        mockMvc.perform(patch("/api/accounts/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(retype)))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Unreferenced account is deleted")
    void deleteAccount() throws Exception {
        UUID id = create(account("6000", "Misc", Account.AccountType.EXPENSE, false));

        mockMvc.perform(delete("/api/accounts/{id}", id))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/accounts/{id}", id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }
}
