package com.flagship.revenue_ledger.account;

import com.flagship.revenue_ledger.LedgerFixtures;
import com.flagship.revenue_ledger.contract.ContractService;
import com.flagship.revenue_ledger.exception.InvalidStateTransitionException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chart of accounts: uniqueness per organization and the guards on
 * system and referenced accounts.
 */
@SpringBootTest
@ActiveProfiles("test")
class AccountServiceTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private ContractService contractService;

    private LedgerFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(accountService, contractService);
    }

    @Test
    @DisplayName("Accounts are listed per organization, ordered by code")
    void listAccounts_PerOrganization() {
        List<Account> accounts = accountService.listAccounts(fixtures.organizationId);

        assertEquals(List.of("1000", "2400", "4000"), accounts.stream().map(Account::getCode).toList());
        assertTrue(accountService.listAccounts(UUID.randomUUID()).isEmpty());
    }

    @Test
    @DisplayName("Account codes are unique within an organization only")
    void createAccount_DuplicateCode() {
        assertThrows(ValidationException.class,
            () -> accountService.createAccount(fixtures.organizationId, "4000", "Other", Account.AccountType.REVENUE, false));

        Account elsewhere = accountService.createAccount(UUID.randomUUID(), "4000", "Revenue",
            Account.AccountType.REVENUE, false);
        assertEquals("4000", elsewhere.getCode());
    }

    @Test
    @DisplayName("Deactivating an account keeps the other fields")
    void updateAccount_Deactivate() {
        Account updated = accountService.updateAccount(fixtures.revenue.getId(), null, null, false);

        assertFalse(updated.isActive());
        assertEquals(fixtures.revenue.getName(), updated.getName());
        assertEquals(Account.AccountType.REVENUE, updated.getType());
    }

    @Test
    @DisplayName("System accounts cannot be retyped or deleted")
    void systemAccount_Guards() {
        UUID deferredId = fixtures.deferredRevenue.getId();

        assertThrows(InvalidStateTransitionException.class,
            () -> accountService.updateAccount(deferredId, null, Account.AccountType.EQUITY, null));
        assertThrows(InvalidStateTransitionException.class, () -> accountService.deleteAccount(deferredId));
    }

    @Test
    @DisplayName("An account referenced by a contract line cannot be deleted")
    void deleteAccount_Referenced() {
        fixtures.draftContract("1000.00", fixtures.pointInTime("Setup fee", "1000.00",
            LocalDate.of(2024, 1, 15)));

        assertThrows(InvalidStateTransitionException.class,
            () -> accountService.deleteAccount(fixtures.revenue.getId()));
    }

    @Test
    @DisplayName("An unused account can be deleted")
    void deleteAccount_Unused() {
        Account unused = fixtures.account("6100", Account.AccountType.EXPENSE);

        accountService.deleteAccount(unused.getId());

        assertThrows(NotFoundException.class, () -> accountService.requireAccount(unused.getId()));
    }

    @Test
    @DisplayName("Usable accounts must exist, be active and belong to the organization")
    void requireUsableAccount_Rules() {
        UUID otherOrganization = UUID.randomUUID();
        UUID revenueId = fixtures.revenue.getId();

        assertEquals(revenueId, accountService.requireUsableAccount(revenueId, fixtures.organizationId, "Revenue").getId());
        assertThrows(ValidationException.class,
            () -> accountService.requireUsableAccount(revenueId, otherOrganization, "Revenue"));
        assertThrows(ValidationException.class,
            () -> accountService.requireUsableAccount(UUID.randomUUID(), fixtures.organizationId, "Revenue"));

        accountService.updateAccount(revenueId, null, null, false);
        assertThrows(ValidationException.class,
            () -> accountService.requireUsableAccount(revenueId, fixtures.organizationId, "Revenue"));
    }
}
